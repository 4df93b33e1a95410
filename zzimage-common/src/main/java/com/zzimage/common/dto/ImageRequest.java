package com.zzimage.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 校验并补全默认值之后、发往后端的单次生成参数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageRequest {

    private String prompt;
    private String negativePrompt;
    private int width;
    private int height;
    private String model;
    private int steps;

    public String size() {
        return width + "x" + height;
    }
}
