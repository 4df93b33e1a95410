package com.zzimage.web.controller;

import com.zzimage.backend.config.BackendProperties;
import com.zzimage.common.dto.GenerationRequest;
import com.zzimage.common.dto.GenerationResult;
import com.zzimage.common.dto.ImageResult;
import com.zzimage.dispatcher.config.GenerationProperties;
import com.zzimage.dispatcher.service.GenerationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GenerateControllerTest {

    private GenerationOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(GenerationOrchestrator.class);
        GenerateController controller = new GenerateController(
                orchestrator, new GenerationProperties(), new BackendProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void generate_returnsSnakeCaseResult() throws Exception {
        when(orchestrator.generate(any())).thenReturn(GenerationResult.ok(ImageResult.builder()
                .imageUrl("https://cdn.example.com/cat.png")
                .build()));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"a cat\",\"negative_prompt\":\"blurry\",\"width\":512,"
                                + "\"height\":768,\"num_inference_steps\":12}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.image_url").value("https://cdn.example.com/cat.png"))
                .andExpect(jsonPath("$.error").doesNotExist());

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(orchestrator).generate(captor.capture());
        GenerationRequest request = captor.getValue();
        assertEquals("blurry", request.getNegativePrompt());
        assertEquals(768, request.getHeight());
        assertEquals(12, request.getSteps());
    }

    @Test
    void generate_failureIsReportedInBody() throws Exception {
        when(orchestrator.generate(any()))
                .thenReturn(GenerationResult.failure("VALIDATION_ERROR", "尺寸不能小于 256x256"));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"a cat\",\"width\":100,\"height\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error").value("尺寸不能小于 256x256"));
    }

    @Test
    void generate_malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_BODY"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void presets_includeBounds() throws Exception {
        mockMvc.perform(get("/api/generate/presets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.min_size").value(256))
                .andExpect(jsonPath("$.max_size").value(2048))
                .andExpect(jsonPath("$.presets['1:1'][1]").value("1024x1024"));
    }

    @Test
    void models_listDefault() throws Exception {
        mockMvc.perform(get("/api/generate/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.default").value("z-image-turbo"))
                .andExpect(jsonPath("$.models[0].id").value("z-image-turbo"));
    }

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/api/generate/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
