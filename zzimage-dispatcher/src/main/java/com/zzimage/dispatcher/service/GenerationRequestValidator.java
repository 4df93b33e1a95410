package com.zzimage.dispatcher.service;

import com.zzimage.backend.config.BackendProperties;
import com.zzimage.common.dto.GenerationRequest;
import com.zzimage.common.dto.ImageRequest;
import com.zzimage.common.exception.ValidationException;
import com.zzimage.dispatcher.config.GenerationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 生成请求校验：在选择任何凭证之前检查参数边界，并补全默认值。
 */
@Component
@RequiredArgsConstructor
public class GenerationRequestValidator {

    private final GenerationProperties generationProperties;
    private final BackendProperties backendProperties;

    /**
     * @throws ValidationException 参数越界
     */
    public ImageRequest validate(GenerationRequest request) {
        if (request == null) {
            throw new ValidationException("请求不能为空");
        }

        String prompt = request.getPrompt();
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("提示词不能为空");
        }
        if (prompt.length() > generationProperties.getMaxPromptLength()) {
            throw new ValidationException("提示词长度不能超过 " + generationProperties.getMaxPromptLength());
        }

        String negativePrompt = request.getNegativePrompt();
        if (negativePrompt != null && negativePrompt.length() > generationProperties.getMaxNegativePromptLength()) {
            throw new ValidationException("负向提示词长度不能超过 " + generationProperties.getMaxNegativePromptLength());
        }

        int width = request.getWidth() != null ? request.getWidth() : generationProperties.getDefaultWidth();
        int height = request.getHeight() != null ? request.getHeight() : generationProperties.getDefaultHeight();
        int min = generationProperties.getMinImageSize();
        int max = generationProperties.getMaxImageSize();
        if (width < min || height < min) {
            throw new ValidationException("尺寸不能小于 " + min + "x" + min);
        }
        if (width > max || height > max) {
            throw new ValidationException("尺寸不能大于 " + max + "x" + max);
        }

        int steps = request.getSteps() != null ? request.getSteps() : backendProperties.getDefaultSteps();
        if (steps < generationProperties.getMinSteps() || steps > generationProperties.getMaxSteps()) {
            throw new ValidationException("推理步数必须在 " + generationProperties.getMinSteps()
                    + "-" + generationProperties.getMaxSteps() + " 之间");
        }

        String model = request.getModel() == null || request.getModel().isBlank()
                ? backendProperties.getDefaultModel()
                : request.getModel().trim();

        return ImageRequest.builder()
                .prompt(prompt)
                .negativePrompt(negativePrompt == null || negativePrompt.isBlank() ? null : negativePrompt)
                .width(width)
                .height(height)
                .model(model)
                .steps(steps)
                .build();
    }
}
