package io.mnemo.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.pricing.PricingCatalog;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.time.CancellationToken;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnthropicProviderTest {

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
    void shouldSendMessagesRequestAndParseText() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "model": "claude-3-haiku-20240307",
                  "content": [
                    {"type": "text", "text": "{\\"schemaVersion\\": "},
                    {"type": "text", "text": "\\"v1\\"}"}
                  ],
                  "stop_reason": "end_turn",
                  "usage": {"input_tokens": 120, "output_tokens": 40}
                }
                """));

        ProviderResponse response = provider("claude-3-haiku-20240307").send(request(), CancellationToken.none());

        assertThat(response.content()).isEqualTo("{\"schemaVersion\": \"v1\"}");
        assertThat(response.usage()).isEqualTo(new TokenUsage(120, 40));
        assertThat(response.model()).isEqualTo("claude-3-haiku-20240307");
        assertThat(response.finishReason()).isEqualTo("end_turn");
        assertThat(response.truncated()).isFalse();

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/messages");
        assertThat(recorded.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(recorded.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        String body = recorded.getBody().readUtf8();
        assertThat(body)
            .contains("\"model\":\"claude-3-haiku-20240307\"")
            .contains("\"system\":\"extract memories\"")
            .contains("\"max_tokens\":1024")
            .doesNotContain("\"role\":\"system\"")
            .doesNotContain("\"stream\"");
    }

    @Test
    void shouldReportMaxTokensStopAsTruncated() {
        server.enqueue(new MockResponse().setBody("""
            {"content": [{"type": "text", "text": "{\\"memo"}], "stop_reason": "max_tokens", "usage": {"input_tokens": 5, "output_tokens": 1024}}
            """));

        ProviderResponse response = provider("").send(request(), CancellationToken.none());

        assertThat(response.truncated()).isTrue();
        assertThat(response.model()).isEqualTo(AnthropicProvider.DEFAULT_MODEL);
    }

    @Test
    void shouldClassifyRateLimitWithRetryAfter() {
        server.enqueue(new MockResponse()
            .setResponseCode(429)
            .setHeader("Retry-After", "7")
            .setBody("{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\"}}"));

        assertThatThrownBy(() -> provider("").send(request(), CancellationToken.none()))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.RATE_LIMIT);
                assertThat(e.httpStatus()).contains(429);
                assertThat(e.retryAfter()).contains(Duration.ofSeconds(7));
                assertThat(e.local()).isFalse();
            });
    }

    @Test
    void shouldStreamMessageEvents() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                event: message_start
                data: {"type":"message_start","message":{"usage":{"input_tokens":25,"output_tokens":1}}}

                event: ping
                data: {"type":"ping"}

                event: content_block_delta
                data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Hello"}}

                event: content_block_delta
                data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":" world"}}

                event: message_delta
                data: {"type":"message_delta","delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":15}}

                event: message_stop
                data: {"type":"message_stop"}

                """));

        List<StreamEvent> events = new ArrayList<>();
        try (ProviderStream stream = provider("").stream(request(), CancellationToken.none())) {
            stream.forEachRemaining(events::add);
        }

        assertThat(events).extracting(StreamEvent::type).containsExactly(
            StreamEventType.START, StreamEventType.DELTA, StreamEventType.DELTA, StreamEventType.STOP);
        assertThat(events.get(0).usage()).isEqualTo(new TokenUsage(25, 1));
        assertThat(events.get(1).text() + events.get(2).text()).isEqualTo("Hello world");
        assertThat(events.get(3).usage()).isEqualTo(new TokenUsage(25, 15));
        assertThat(events.get(3).finishReason()).isEqualTo("end_turn");

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("\"stream\":true");
    }

    @Test
    void shouldSurfaceInStreamErrorEvent() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"type":"message_start","message":{"usage":{"input_tokens":25,"output_tokens":1}}}

                data: {"type":"error","error":{"type":"overloaded_error","message":"Overloaded"}}

                """));

        List<StreamEvent> events = new ArrayList<>();
        try (ProviderStream stream = provider("").stream(request(), CancellationToken.none())) {
            stream.forEachRemaining(events::add);
        }

        assertThat(events).extracting(StreamEvent::type).containsExactly(StreamEventType.START, StreamEventType.ERROR);
        assertThat(events.get(1).error().kind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(events.get(1).error().getMessage()).contains("Overloaded");
    }

    @Test
    void shouldEndWithoutStopWhenStreamIsCutOff() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"type":"message_start","message":{"usage":{"input_tokens":25,"output_tokens":1}}}

                data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"{\\"memo"}}

                """));

        List<StreamEvent> events = new ArrayList<>();
        try (ProviderStream stream = provider("").stream(request(), CancellationToken.none())) {
            stream.forEachRemaining(events::add);
        }

        assertThat(events).extracting(StreamEvent::type).containsExactly(StreamEventType.START, StreamEventType.DELTA);
    }

    @Test
    void shouldNotCallWhenTokenAlreadyCancelled() {
        CancellationToken token = CancellationToken.cancellable(Clock.systemUTC());
        token.cancel();

        assertThatThrownBy(() -> provider("").send(request(), token)).isInstanceOf(CancellationException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldRejectMissingApiKey() {
        AnthropicProvider provider = new AnthropicProvider(
            new ProviderSettings("", "", server.url("/v1").toString()),
            PricingCatalog.defaults()
        );

        assertThatThrownBy(() -> provider.send(request(), CancellationToken.none()))
            .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_REQUEST));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldEstimateCostFromCatalog() {
        AnthropicProvider provider = provider("claude-3-haiku-20240307");

        assertThat(provider.estimateCost(1000, 1000)).isCloseTo(0.0015, within(1e-9));
        assertThat(provider.estimateTokens("abcdefgh")).isEqualTo(2);
        assertThat(provider.capabilities().supportsStreaming()).isTrue();
    }

    private AnthropicProvider provider(String model) {
        return new AnthropicProvider(
            new ProviderSettings("sk-ant", model, server.url("/v1").toString()),
            PricingCatalog.defaults(),
            null
        );
    }

    private static ProviderRequest request() {
        return new ProviderRequest(
            List.of(ChatMessage.system("extract memories"), ChatMessage.user("conversation")),
            1024,
            0.2,
            Duration.ofSeconds(5)
        );
    }
}
