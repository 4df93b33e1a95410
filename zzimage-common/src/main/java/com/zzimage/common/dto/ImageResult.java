package com.zzimage.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 后端返回的图片：URL 与 Base64 至少有一个。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageResult {

    private String imageUrl;

    private String imageBase64;

    @Builder.Default
    private String mimeType = "image/png";
}
