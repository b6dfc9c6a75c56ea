package io.threadkeep.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.threadkeep.core.model.Message;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Anthropic Messages API client. Failures come back as {@link LlmProvider#ERROR_PREFIX} content
 * instead of exceptions.
 */
public final class AnthropicProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_TOKENS = 4096;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<Message> messages) {
        if (apiKey.isBlank()) {
            return new LlmResponse(ERROR_PREFIX + " missing API key for provider " + name, Map.of());
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(model, messages);
                try (Response response = client.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, 2000);
                            continue;
                        }
                        return new LlmResponse(
                            ERROR_PREFIX + " HTTP " + response.code() + " " + errorBody,
                            Map.of("http_status", response.code())
                        );
                    }

                    if (response.body() == null) {
                        return new LlmResponse("", Map.of());
                    }
                    return parseResponse(response.body().string());
                }
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                return new LlmResponse(ERROR_PREFIX + " " + ioe.getMessage(), Map.of());
            } catch (RuntimeException e) {
                return new LlmResponse(ERROR_PREFIX + " " + e.getMessage(), Map.of());
            }
        }

        return new LlmResponse(ERROR_PREFIX + " exhausted retries", Map.of());
    }

    private Request buildRequest(String model, List<Message> messages) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", MAX_TOKENS);
        payload.put("messages", toWireMessages(messages));

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(messagesUrl())
            .post(body)
            .header("x-api-key", apiKey)
            .header("anthropic-version", "2023-06-01")
            .header("content-type", "application/json")
            .build();
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<Message> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (Message message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireName());
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private LlmResponse parseResponse(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        StringBuilder content = new StringBuilder();
        for (JsonNode item : root.path("content")) {
            if ("text".equals(item.path("type").asText(""))) {
                content.append(item.path("text").asText(""));
            }
        }

        Map<String, Object> usage = root.has("usage")
            ? mapper.convertValue(root.path("usage"), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new LlmResponse(content.toString(), usage);
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
