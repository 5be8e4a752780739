package io.mnemo.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.MessageRole;
import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.pricing.PricingCatalog;
import io.mnemo.core.retry.ErrorKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

public final class AnthropicProvider extends AbstractHttpProvider {
    public static final String NAME = "claude";
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    public static final String DEFAULT_MODEL = "claude-3-sonnet";

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
        200_000,
        4096,
        true,
        false,
        List.of("claude-3-opus", "claude-3-sonnet", "claude-3-haiku")
    );

    public AnthropicProvider(ProviderSettings settings, PricingCatalog pricing) {
        this(settings, pricing, null);
    }

    public AnthropicProvider(ProviderSettings settings, PricingCatalog pricing, OkHttpClient client) {
        super(NAME, settings, DEFAULT_BASE_URL, DEFAULT_MODEL, pricing, client);
    }

    @Override
    public ProviderCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    protected Request buildRequest(ProviderRequest request, boolean stream) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model());
        payload.put("max_tokens", Math.min(request.maxTokens(), CAPABILITIES.maxOutputTokens()));
        payload.put("temperature", request.temperature());
        String systemPrompt = extractSystemPrompt(request.messages());
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        payload.put("messages", toWireMessages(request.messages()));
        if (stream) {
            payload.put("stream", true);
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(messagesUrl())
            .post(body)
            .header("x-api-key", settings().apiKey())
            .header("anthropic-version", "2023-06-01")
            .header("content-type", "application/json")
            .header("accept", stream ? "text/event-stream" : "application/json")
            .build();
    }

    private HttpUrl messagesUrl() {
        return apiBase().newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode root) {
        StringBuilder content = new StringBuilder();
        for (JsonNode item : root.path("content")) {
            if ("text".equals(item.path("type").asText(""))) {
                content.append(item.path("text").asText(""));
            }
        }
        JsonNode usage = root.path("usage");
        return new ProviderResponse(
            content.toString(),
            new TokenUsage(usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0)),
            root.path("model").asText(model()),
            root.path("stop_reason").asText("")
        );
    }

    @Override
    protected SsePayloadMapper streamMapper() {
        return new MessageStreamMapper();
    }

    /**
     * Messages API events: message_start, content_block_delta, message_delta, message_stop, error.
     */
    private static final class MessageStreamMapper implements SsePayloadMapper {
        private int inputTokens;
        private int outputTokens;
        private String stopReason = "";

        @Override
        public List<StreamEvent> map(JsonNode payload) {
            String type = payload.path("type").asText("");
            switch (type) {
                case "message_start": {
                    JsonNode usage = payload.path("message").path("usage");
                    inputTokens = usage.path("input_tokens").asInt(0);
                    outputTokens = usage.path("output_tokens").asInt(0);
                    return List.of(StreamEvent.start(new TokenUsage(inputTokens, outputTokens)));
                }
                case "content_block_delta": {
                    JsonNode delta = payload.path("delta");
                    if ("text_delta".equals(delta.path("type").asText("")) && delta.hasNonNull("text")) {
                        return List.of(StreamEvent.delta(delta.path("text").asText("")));
                    }
                    return List.of();
                }
                case "message_delta": {
                    outputTokens = payload.path("usage").path("output_tokens").asInt(outputTokens);
                    stopReason = payload.path("delta").path("stop_reason").asText(stopReason);
                    return List.of();
                }
                case "message_stop":
                    return List.of(StreamEvent.stop(new TokenUsage(inputTokens, outputTokens), stopReason));
                case "error": {
                    JsonNode error = payload.path("error");
                    ErrorKind kind = HttpErrorClassifier.classifyErrorType(error.path("type").asText(""));
                    return List.of(StreamEvent.error(new ProviderException(
                        kind,
                        "Stream error from " + NAME + ": " + error.path("message").asText("")
                    )));
                }
                default:
                    return List.of();
            }
        }

        @Override
        public List<StreamEvent> done() {
            return List.of(StreamEvent.stop(new TokenUsage(inputTokens, outputTokens), stopReason));
        }
    }
}
