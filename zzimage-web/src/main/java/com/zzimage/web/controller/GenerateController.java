package com.zzimage.web.controller;

import com.zzimage.backend.config.BackendProperties;
import com.zzimage.common.dto.GenerationRequest;
import com.zzimage.common.dto.GenerationResult;
import com.zzimage.dispatcher.config.GenerationProperties;
import com.zzimage.dispatcher.service.GenerationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 文生图接口。
 */
@Slf4j
@RestController
@RequestMapping("/api/generate")
@RequiredArgsConstructor
public class GenerateController {

    private final GenerationOrchestrator orchestrator;
    private final GenerationProperties generationProperties;
    private final BackendProperties backendProperties;

    /**
     * 生成图片。业务失败同样返回 200，由 success / error_code 区分。
     */
    @PostMapping
    public GenerationResult generate(@RequestBody GenerationRequest request) {
        log.info("收到生成请求: {}x{}, model={}, steps={}",
                request.getWidth(), request.getHeight(), request.getModel(), request.getSteps());
        long start = System.currentTimeMillis();
        GenerationResult result = orchestrator.generate(request);
        log.info("生成请求结束: success={}, 耗时 {}ms", result.isSuccess(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 预设尺寸与尺寸边界。
     */
    @GetMapping("/presets")
    public Map<String, Object> presets() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("presets", generationProperties.getPresets());
        body.put("min_size", generationProperties.getMinImageSize());
        body.put("max_size", generationProperties.getMaxImageSize());
        return body;
    }

    @GetMapping("/models")
    public Map<String, Object> models() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("models", backendProperties.getModels());
        body.put("default", backendProperties.getDefaultModel());
        return body;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", "image-generator");
    }
}
