package io.mnemo.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.pricing.PricingCatalog;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendChatCompletionWithJsonMode() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "model": "gpt-4-turbo-2024-04-09",
                  "choices": [{"message": {"role": "assistant", "content": "{}"}, "finish_reason": "stop"}],
                  "usage": {"prompt_tokens": 200, "completion_tokens": 30}
                }
                """));

        ProviderResponse response = provider(new ProviderSettings(
            "sk-test", "", server.url("/v1").toString(), "org-42", Map.of("X-Gateway", "mnemo")
        )).send(request(), CancellationToken.none());

        assertThat(response.content()).isEqualTo("{}");
        assertThat(response.usage()).isEqualTo(new TokenUsage(200, 30));
        assertThat(response.model()).isEqualTo("gpt-4-turbo-2024-04-09");
        assertThat(response.finishReason()).isEqualTo("stop");

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(recorded.getHeader("OpenAI-Organization")).isEqualTo("org-42");
        assertThat(recorded.getHeader("X-Gateway")).isEqualTo("mnemo");
        String body = recorded.getBody().readUtf8();
        assertThat(body)
            .contains("\"model\":\"gpt-4-turbo\"")
            .contains("\"role\":\"system\"")
            .contains("\"response_format\":{\"type\":\"json_object\"}");
    }

    @Test
    void shouldOmitJsonModeForModelsWithoutIt() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"choices": [{"message": {"content": "{}"}, "finish_reason": "length"}], "usage": {}}
            """));

        ProviderResponse response = provider(new ProviderSettings("sk-test", "gpt-4", server.url("/v1").toString()))
            .send(request(), CancellationToken.none());

        assertThat(response.truncated()).isTrue();
        assertThat(response.usage().reported()).isFalse();
        assertThat(server.takeRequest().getBody().readUtf8()).doesNotContain("response_format");
    }

    @Test
    void shouldStreamChunksAndReportTrailingUsage() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"role":"assistant","content":""},"finish_reason":null}]}

                data: {"choices":[{"delta":{"content":"Hello"},"finish_reason":null}]}

                data: {"choices":[{"delta":{"content":" world"},"finish_reason":null}]}

                data: {"choices":[{"delta":{},"finish_reason":"stop"}]}

                data: {"choices":[],"usage":{"prompt_tokens":30,"completion_tokens":12}}

                data: [DONE]

                """));

        List<StreamEvent> events = new ArrayList<>();
        try (ProviderStream stream = provider(settings()).stream(request(), CancellationToken.none())) {
            stream.forEachRemaining(events::add);
        }

        assertThat(events).extracting(StreamEvent::type).containsExactly(
            StreamEventType.START, StreamEventType.DELTA, StreamEventType.DELTA, StreamEventType.STOP);
        assertThat(events.get(1).text() + events.get(2).text()).isEqualTo("Hello world");
        assertThat(events.get(3).usage()).isEqualTo(new TokenUsage(30, 12));
        assertThat(events.get(3).finishReason()).isEqualTo("stop");
        assertThat(server.takeRequest().getBody().readUtf8())
            .contains("\"stream\":true")
            .contains("\"include_usage\":true");
    }

    @Test
    void shouldReportMalformedChunkAsStreamError() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"content":"Hi"}}]}

                data: {not json

                """));

        List<StreamEvent> events = new ArrayList<>();
        try (ProviderStream stream = provider(settings()).stream(request(), CancellationToken.none())) {
            stream.forEachRemaining(events::add);
        }

        assertThat(events).extracting(StreamEvent::type).containsExactly(
            StreamEventType.START, StreamEventType.DELTA, StreamEventType.ERROR);
        assertThat(events.get(2).error().kind()).isEqualTo(ErrorKind.UNKNOWN);
    }

    @Test
    void shouldClassifyQuotaExhaustionAsBudget() {
        server.enqueue(new MockResponse()
            .setResponseCode(429)
            .setBody("{\"error\":{\"type\":\"insufficient_quota\",\"message\":\"You exceeded your current quota\"}}"));

        assertThatThrownBy(() -> provider(settings()).send(request(), CancellationToken.none()))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.BUDGET_EXCEEDED);
                assertThat(e.retryAfter()).isEmpty();
            });
    }

    @Test
    void shouldClassifyStreamOpenFailureByStatus() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream unavailable"));

        assertThatThrownBy(() -> provider(settings()).stream(request(), CancellationToken.none()))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.TRANSIENT);
                assertThat(e.getMessage()).contains("HTTP 503").contains("upstream unavailable");
            });
    }

    @Test
    void shouldKeepCustomNameForCompatibleGateways() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("gateway", settings(), PricingCatalog.defaults(), null);

        assertThat(provider.name()).isEqualTo("gateway");
        assertThat(provider.estimateCost(1000, 1000)).isZero();
        assertThat(provider.capabilities().jsonMode()).isTrue();
    }

    private OpenAiCompatProvider provider(ProviderSettings settings) {
        return new OpenAiCompatProvider(OpenAiCompatProvider.NAME, settings, PricingCatalog.defaults(), null);
    }

    private ProviderSettings settings() {
        return new ProviderSettings("sk-test", "", server.url("/v1").toString());
    }

    private static ProviderRequest request() {
        return new ProviderRequest(
            List.of(ChatMessage.system("extract memories"), ChatMessage.user("conversation")),
            512,
            0.2,
            Duration.ofSeconds(5)
        );
    }
}
