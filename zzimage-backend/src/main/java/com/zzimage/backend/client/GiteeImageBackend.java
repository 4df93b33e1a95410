package com.zzimage.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzimage.backend.config.BackendProperties;
import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.ImageRequest;
import com.zzimage.common.dto.ImageResult;
import com.zzimage.common.exception.BackendCallException;
import com.zzimage.common.exception.FailureKind;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gitee AI 文生图接口实现（OpenAI images 兼容格式）。
 * <p>
 * 请求体: {@code {"prompt", "model", "size": "WxH", "num_inference_steps", "negative_prompt"?}}<br>
 * 响应体: {@code {"created": ts, "data": [{"b64_json": "...", "url": "...", "type": "image/png"}]}}
 */
@Slf4j
@Component
public class GiteeImageBackend implements ImageBackend {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient backendHttpClient;
    private final BackendProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /** 代理地址 -> 派生客户端 */
    private final Map<String, OkHttpClient> proxiedClients = new ConcurrentHashMap<>();

    public GiteeImageBackend(OkHttpClient backendHttpClient, BackendProperties properties) {
        this.backendHttpClient = backendHttpClient;
        this.properties = properties;
    }

    @Override
    public ImageResult generate(Credential credential, ImageRequest imageRequest) {
        OkHttpClient client = clientFor(credential);
        String url = properties.getBaseUrl() + properties.getEndpoint();

        Request request = new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bearer " + credential.getSecret())
                .addHeader("User-Agent", properties.getUserAgent())
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(buildRequestBody(imageRequest), JSON_MEDIA))
                .build();

        log.info("发送生成请求 [{}]: model={}, size={}, 凭证={}",
                getBackendName(), imageRequest.getModel(), imageRequest.size(), credential.getLabel());

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            log.debug("后端响应 [{}]: {}", response.code(), abbreviate(body));

            if (response.isSuccessful()) {
                return parseImage(body);
            }
            throw classify(response.code(), body);

        } catch (BackendCallException e) {
            throw e;
        } catch (IOException e) {
            // 连接失败、超时、代理连不上都归为网络错误
            throw new BackendCallException(FailureKind.TRANSPORT, "请求失败: " + e.getMessage(), e);
        }
    }

    @Override
    public String getBackendName() {
        return "gitee";
    }

    // ======================== 请求/响应 ========================

    private String buildRequestBody(ImageRequest imageRequest) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("prompt", imageRequest.getPrompt());
        root.put("model", imageRequest.getModel());
        root.put("size", imageRequest.size());
        root.put("num_inference_steps", imageRequest.getSteps());
        if (imageRequest.getNegativePrompt() != null && !imageRequest.getNegativePrompt().isBlank()) {
            root.put("negative_prompt", imageRequest.getNegativePrompt());
        }
        return root.toString();
    }

    private ImageResult parseImage(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new BackendCallException(FailureKind.SERVER_ERROR, "API返回数据格式异常", e);
        }

        JsonNode data = json.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new BackendCallException(FailureKind.SERVER_ERROR, "API返回数据格式异常");
        }

        JsonNode image = data.path(0);
        String base64 = textOrNull(image, "b64_json");
        String imageUrl = textOrNull(image, "url");
        if (base64 == null && imageUrl == null) {
            throw new BackendCallException(FailureKind.SERVER_ERROR, "API返回数据中没有图片");
        }

        return ImageResult.builder()
                .imageBase64(base64)
                .imageUrl(imageUrl)
                .mimeType(image.path("type").asText("image/png"))
                .build();
    }

    /**
     * HTTP 状态码到失败分类的映射。
     */
    BackendCallException classify(int status, String body) {
        if (status == 429) {
            return new BackendCallException(FailureKind.RATE_LIMITED, "后端限流: 429");
        }
        if (status == 401 || status == 403) {
            return new BackendCallException(FailureKind.AUTH_INVALID, "凭证无效或已过期: " + status);
        }
        if (status == 400) {
            return new BackendCallException(FailureKind.BAD_REQUEST, "请求参数错误: " + extractErrorMessage(body));
        }
        log.error("后端错误 {}: {}", status, abbreviate(body));
        return new BackendCallException(FailureKind.SERVER_ERROR, "API错误: " + status);
    }

    private String extractErrorMessage(String body) {
        try {
            String message = objectMapper.readTree(body).path("error").path("message").asText("");
            return message.isEmpty() ? body : message;
        } catch (IOException e) {
            return body;
        }
    }

    // ======================== 代理 ========================

    private OkHttpClient clientFor(Credential credential) {
        if (!credential.hasProxy()) {
            return backendHttpClient;
        }
        try {
            return proxiedClients.computeIfAbsent(credential.getProxy().trim(), this::buildProxiedClient);
        } catch (IllegalArgumentException e) {
            throw new BackendCallException(FailureKind.SERVER_ERROR, "代理配置无效: " + e.getMessage(), e);
        }
    }

    private OkHttpClient buildProxiedClient(String proxyUrl) {
        ProxyResolver.ProxySpec spec = ProxyResolver.parse(proxyUrl);
        log.info("创建代理客户端: {} {}", spec.getProxy().type(), spec.getProxy().address());
        return backendHttpClient.newBuilder()
                .proxy(spec.getProxy())
                .proxyAuthenticator(spec.getAuthenticator())
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static String abbreviate(String body) {
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
