package com.zzimage.backend.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 文生图后端配置项。
 */
@Data
@ConfigurationProperties(prefix = "zzimage.backend")
public class BackendProperties {

    /** 后端地址 */
    private String baseUrl = "https://ai.gitee.com";

    /** 生成接口路径 */
    private String endpoint = "/v1/images/generations";

    private String defaultModel = "z-image-turbo";

    private int defaultSteps = 9;

    /** 单次调用的总超时（秒），超时按网络错误处理 */
    private int requestTimeoutSeconds = 120;

    private int connectTimeoutSeconds = 10;

    private String userAgent = "ZZImage/1.0";

    /** 对外展示的可用模型列表 */
    private List<ModelInfo> models = new ArrayList<>(List.of(
            new ModelInfo("z-image-turbo", "Z-Image Turbo", "快速生成模型，推荐步数9")));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelInfo {
        private String id;
        private String name;
        private String description;
    }
}
