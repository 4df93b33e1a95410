package com.zzimage.common.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文生图请求。width/height 为空时使用默认尺寸，model/steps 为空时使用后端默认值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerationRequest {

    /** 正向提示词 */
    private String prompt;

    /** 负向提示词（可选） */
    private String negativePrompt;

    private Integer width;

    private Integer height;

    /** 模型名称（可选） */
    private String model;

    /** 推理步数（可选） */
    @JsonProperty("num_inference_steps")
    @JsonAlias("steps")
    private Integer steps;
}
