package com.zzimage.dispatcher.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次凭证尝试的日志记录（每个凭证每次请求一条）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttemptRecord {

    private String prompt;
    private int width;
    private int height;
    private Long credentialId;
    private boolean success;
    private String errorMessage;

    /** 后端返回的图片地址，仅返回 Base64 时为空 */
    private String imageUrl;

    private long latencyMs;

    /** 本凭证上实际发起的后端调用次数（含被吸收的限流/网络重试） */
    private int backendCalls;
}
