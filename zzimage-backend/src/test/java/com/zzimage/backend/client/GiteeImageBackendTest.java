package com.zzimage.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzimage.backend.config.BackendProperties;
import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.ImageRequest;
import com.zzimage.common.dto.ImageResult;
import com.zzimage.common.exception.BackendCallException;
import com.zzimage.common.exception.FailureKind;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GiteeImageBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private GiteeImageBackend backend;

    private final Credential credential = Credential.builder()
            .id(1L)
            .label("alice")
            .secret("gitee-token-0001")
            .build();

    private final ImageRequest imageRequest = ImageRequest.builder()
            .prompt("a cat in the snow")
            .width(1024)
            .height(768)
            .model("z-image-turbo")
            .steps(9)
            .build();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        BackendProperties properties = new BackendProperties();
        properties.setBaseUrl(server.url("/").toString().replaceAll("/$", ""));

        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(1))
                .retryOnConnectionFailure(false)
                .build();
        backend = new GiteeImageBackend(client, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void success_returnsBase64AndSendsExpectedRequest() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"created\":1,\"data\":[{\"b64_json\":\"aGVsbG8=\",\"type\":\"image/png\"}]}"));

        ImageResult result = backend.generate(credential, imageRequest);

        assertEquals("aGVsbG8=", result.getImageBase64());
        assertNull(result.getImageUrl());
        assertEquals("image/png", result.getMimeType());

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("/v1/images/generations", recorded.getPath());
        assertEquals("Bearer gitee-token-0001", recorded.getHeader("Authorization"));
        assertEquals("ZZImage/1.0", recorded.getHeader("User-Agent"));

        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("a cat in the snow", body.path("prompt").asText());
        assertEquals("1024x768", body.path("size").asText());
        assertEquals(9, body.path("num_inference_steps").asInt());
        assertFalse(body.has("negative_prompt"), "空负向提示词不应出现在请求体中");
    }

    @Test
    void success_withUrlOnly() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"data\":[{\"url\":\"https://cdn.example.com/x.png\"}]}"));

        ImageResult result = backend.generate(credential, imageRequest);

        assertEquals("https://cdn.example.com/x.png", result.getImageUrl());
        assertNull(result.getImageBase64());
    }

    @Test
    void negativePrompt_isForwarded() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":[{\"b64_json\":\"eA==\"}]}"));
        ImageRequest withNegative = ImageRequest.builder()
                .prompt("p").negativePrompt("blurry").width(512).height(512).model("m").steps(4).build();

        backend.generate(credential, withNegative);

        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("blurry", body.path("negative_prompt").asText());
    }

    @Test
    void status429_isRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        assertKind(FailureKind.RATE_LIMITED);
    }

    @Test
    void status401_isAuthInvalid() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{}"));
        assertKind(FailureKind.AUTH_INVALID);
    }

    @Test
    void status403_isAuthInvalid() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{}"));
        assertKind(FailureKind.AUTH_INVALID);
    }

    @Test
    void status400_isBadRequestWithBackendMessage() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"message\":\"size not supported\"}}"));

        BackendCallException e = assertKind(FailureKind.BAD_REQUEST);
        assertTrue(e.getMessage().contains("size not supported"));
    }

    @Test
    void status500_isServerError() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        BackendCallException e = assertKind(FailureKind.SERVER_ERROR);
        assertTrue(e.getMessage().contains("502"));
    }

    @Test
    void emptyData_isServerError() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":[]}"));
        assertKind(FailureKind.SERVER_ERROR);
    }

    @Test
    void imageWithoutPayload_isServerError() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":[{\"type\":\"image/png\"}]}"));
        assertKind(FailureKind.SERVER_ERROR);
    }

    @Test
    void noResponse_isTransport() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        assertKind(FailureKind.TRANSPORT);
    }

    @Test
    void invalidProxy_failsOverWithoutCallingBackend() {
        Credential badProxy = Credential.builder()
                .id(2L).label("bob").secret("gitee-token-0002").proxy("ftp://proxy.local:21").build();

        BackendCallException e = assertThrows(BackendCallException.class,
                () -> backend.generate(badProxy, imageRequest));

        assertEquals(FailureKind.SERVER_ERROR, e.getKind());
        assertTrue(e.getMessage().startsWith("代理配置无效"));
        assertEquals(0, server.getRequestCount());
    }

    private BackendCallException assertKind(FailureKind expected) {
        BackendCallException e = assertThrows(BackendCallException.class,
                () -> backend.generate(credential, imageRequest));
        assertEquals(expected, e.getKind());
        return e;
    }
}
