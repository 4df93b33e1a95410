package com.zzimage.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成请求的参数边界与预设尺寸。
 */
@Data
@ConfigurationProperties(prefix = "zzimage.generation")
public class GenerationProperties {

    private int minImageSize = 256;

    private int maxImageSize = 2048;

    private int defaultWidth = 1024;

    private int defaultHeight = 1024;

    private int maxPromptLength = 4000;

    private int maxNegativePromptLength = 2000;

    private int minSteps = 1;

    private int maxSteps = 50;

    /** 比例 -> 推荐尺寸列表（WxH） */
    private Map<String, List<String>> presets = defaultPresets();

    private static Map<String, List<String>> defaultPresets() {
        Map<String, List<String>> presets = new LinkedHashMap<>();
        presets.put("1:1", List.of("512x512", "1024x1024"));
        presets.put("4:3", List.of("512x384", "1024x768"));
        presets.put("3:4", List.of("384x512", "768x1024"));
        presets.put("16:9", List.of("512x288", "1024x576", "1920x1080"));
        presets.put("9:16", List.of("288x512", "576x1024", "1080x1920"));
        presets.put("3:2", List.of("512x341", "1024x683"));
        presets.put("2:3", List.of("341x512", "683x1024"));
        return presets;
    }
}
