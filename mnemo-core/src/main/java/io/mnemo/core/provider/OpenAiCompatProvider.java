package io.mnemo.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.MessageRole;
import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.pricing.PricingCatalog;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Chat-completions API as served by OpenAI and compatible gateways.
 */
public final class OpenAiCompatProvider extends AbstractHttpProvider {
    public static final String NAME = "openai";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4-turbo";

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
        128_000,
        4096,
        true,
        true,
        List.of("gpt-4-turbo", "gpt-4", "gpt-3.5-turbo")
    );

    public OpenAiCompatProvider(ProviderSettings settings, PricingCatalog pricing) {
        this(NAME, settings, pricing, null);
    }

    public OpenAiCompatProvider(String name, ProviderSettings settings, PricingCatalog pricing, OkHttpClient client) {
        super(name, settings, DEFAULT_BASE_URL, DEFAULT_MODEL, pricing, client);
    }

    @Override
    public ProviderCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    protected Request buildRequest(ProviderRequest request, boolean stream) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("max_tokens", Math.min(request.maxTokens(), CAPABILITIES.maxOutputTokens()));
        payload.put("temperature", request.temperature());
        if (supportsJsonMode(model())) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        if (stream) {
            payload.put("stream", true);
            payload.put("stream_options", Map.of("include_usage", true));
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + settings().apiKey())
            .header("Content-Type", "application/json")
            .header("Accept", stream ? "text/event-stream" : "application/json");
        if (!settings().organizationId().isBlank()) {
            builder.header("OpenAI-Organization", settings().organizationId());
        }
        for (Map.Entry<String, String> header : settings().extraHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase().newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    // plain gpt-4 predates response_format
    private static boolean supportsJsonMode(String model) {
        String lower = model.toLowerCase(Locale.ROOT);
        return lower.startsWith("gpt-4-turbo") || lower.startsWith("gpt-4o") || lower.startsWith("gpt-3.5-turbo");
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode root) {
        JsonNode choice = root.path("choices").path(0);
        JsonNode usage = root.path("usage");
        return new ProviderResponse(
            choice.path("message").path("content").asText(""),
            new TokenUsage(usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0)),
            root.path("model").asText(model()),
            choice.path("finish_reason").asText("")
        );
    }

    @Override
    protected SsePayloadMapper streamMapper() {
        return new ChunkStreamMapper(name());
    }

    private static final class ChunkStreamMapper implements SsePayloadMapper {
        private final String provider;
        private boolean started;
        private TokenUsage usage = TokenUsage.empty();
        private String finishReason = "";

        private ChunkStreamMapper(String provider) {
            this.provider = provider;
        }

        @Override
        public List<StreamEvent> map(JsonNode payload) {
            List<StreamEvent> events = new ArrayList<>();
            if (payload.has("error")) {
                JsonNode error = payload.path("error");
                events.add(StreamEvent.error(new ProviderException(
                    HttpErrorClassifier.classifyErrorType(error.path("type").asText(error.path("code").asText(""))),
                    "Stream error from " + provider + ": " + error.path("message").asText("")
                )));
                return events;
            }
            if (!started) {
                started = true;
                events.add(StreamEvent.start(TokenUsage.empty()));
            }
            if (payload.hasNonNull("usage")) {
                JsonNode node = payload.path("usage");
                usage = new TokenUsage(node.path("prompt_tokens").asInt(0), node.path("completion_tokens").asInt(0));
            }
            for (JsonNode choice : payload.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.hasNonNull("content")) {
                    String text = delta.path("content").asText("");
                    if (!text.isEmpty()) {
                        events.add(StreamEvent.delta(text));
                    }
                }
                if (choice.hasNonNull("finish_reason")) {
                    finishReason = choice.path("finish_reason").asText("");
                }
            }
            return events;
        }

        @Override
        public List<StreamEvent> done() {
            return List.of(StreamEvent.stop(usage, finishReason));
        }
    }
}
