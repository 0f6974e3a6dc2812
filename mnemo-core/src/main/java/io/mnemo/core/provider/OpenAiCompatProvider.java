package io.mnemo.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.MessageRole;
import io.mnemo.core.model.ToolCall;
import java.io.IOException;
import java.io.InterruptedIOException;
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
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat completions over HTTP against any OpenAI-compatible endpoint ({@code <apiBase>/chat/completions}).
 * Retries 429 and 5xx responses and transport failures with exponential backoff.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3, Duration.ofSeconds(90));
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts,
        Duration readTimeout
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(readTimeout == null ? Duration.ofSeconds(90) : readTimeout)
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools)
        throws IOException {
        if (apiKey.isBlank()) {
            throw new LlmException("missing API key for provider " + name);
        }

        Request request = buildRequest(model, messages, tools);
        long delayMs = 250;
        LlmException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("completion aborted");
            }
            try (Response response = client.newCall(request).execute()) {
                ResponseBody body = response.body();
                String text = body == null ? "" : body.string();
                if (response.isSuccessful()) {
                    return parseJson(text);
                }
                lastFailure = new LlmException("HTTP " + response.code() + " from provider " + name, response.code(), null);
                boolean retryable = response.code() == 429 || response.code() >= 500;
                if (!retryable) {
                    throw lastFailure;
                }
                LOG.debug("Provider {} returned HTTP {} (attempt {}/{})", name, response.code(), attempt, maxAttempts);
            } catch (LlmException e) {
                throw e;
            } catch (IOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("completion aborted");
                }
                lastFailure = new LlmException("Failed to call provider " + name, e);
                LOG.debug("Provider {} call failed (attempt {}/{})", name, attempt, maxAttempts, e);
            }
            if (attempt < maxAttempts) {
                sleep(delayMs);
                delayMs = Math.min(delayMs * 2, 2000);
            }
        }
        throw lastFailure == null ? new LlmException("exhausted retries for provider " + name) : lastFailure;
    }

    private Request buildRequest(String model, List<ChatMessage> messages, List<Map<String, Object>> tools)
        throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("stream", false);
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", tools);
            payload.put("tool_choice", "auto");
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) throws JsonProcessingException {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            if (message.role() == MessageRole.ASSISTANT && !message.toolCalls().isEmpty()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) throws JsonProcessingException {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", mapper.writeValueAsString(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id().isBlank() ? "call_" + i : call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    private LlmResponse parseJson(String body) throws LlmException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LlmException("Unreadable response from provider " + name, e);
        }
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new LlmException("Response from provider " + name + " has no choices");
        }
        String content = message.path("content").isNull() ? "" : message.path("content").asText("");
        return new LlmResponse(content, parseToolCalls(message.path("tool_calls")), usageAsMap(root.path("usage")));
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode function = item.path("function");
            String name = function.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            JsonNode argsNode = function.path("arguments");
            Map<String, Object> args = argsNode.isTextual()
                ? parseArguments(argsNode.asText("{}"))
                : argsNode.isObject() ? mapper.convertValue(argsNode, JSON_OBJECT) : Map.of();
            toolCalls.add(new ToolCall(item.path("id").asText(""), name, args));
        }
        return toolCalls;
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, JSON_OBJECT);
    }

    /**
     * Malformed argument JSON becomes an empty map; the gateway then reports the missing parameters.
     */
    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            LOG.debug("Discarding malformed tool arguments from provider {}", name);
            return Map.of();
        }
    }

    private void sleep(long delayMs) throws InterruptedIOException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("completion aborted");
        }
    }
}
