package com.zzimage.backend.client;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.ImageRequest;
import com.zzimage.common.dto.ImageResult;
import com.zzimage.common.exception.BackendCallException;

/**
 * 文生图后端适配器接口。
 * <p>
 * 实现方负责按凭证配置走代理、施加固定超时，并把失败归类为 {@link com.zzimage.common.exception.FailureKind}。
 * 实现方不得自行重试。
 */
public interface ImageBackend {

    /**
     * 使用指定凭证发起一次生成调用。
     *
     * @param credential 本次使用的凭证（令牌 + 可选代理）
     * @param request    已校验的生成参数
     * @return 生成的图片
     * @throws BackendCallException 调用失败，携带失败分类
     */
    ImageResult generate(Credential credential, ImageRequest request);

    /**
     * 获取后端名称。
     */
    String getBackendName();
}
