package com.zzimage.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次生成请求的最终结果：要么是图片，要么是一条错误信息。
 * 不包含所用凭证的任何信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerationResult {

    private boolean success;

    private String imageUrl;

    private String imageBase64;

    private String error;

    /** VALIDATION_ERROR / POOL_EXHAUSTED / BACKEND_BAD_REQUEST / GENERATION_FAILED */
    private String errorCode;

    public static GenerationResult ok(ImageResult image) {
        return GenerationResult.builder()
                .success(true)
                .imageUrl(image.getImageUrl())
                .imageBase64(image.getImageBase64())
                .build();
    }

    public static GenerationResult failure(String errorCode, String error) {
        return GenerationResult.builder()
                .success(false)
                .errorCode(errorCode)
                .error(error)
                .build();
    }
}
