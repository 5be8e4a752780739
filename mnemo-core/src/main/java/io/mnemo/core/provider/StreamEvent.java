package io.mnemo.core.provider;

import io.mnemo.core.model.TokenUsage;
import java.util.Objects;

/**
 * One event of a streamed completion. {@code text} is set on deltas, {@code usage} on start and
 * stop where the provider reports it, {@code error} only on error events.
 */
public record StreamEvent(StreamEventType type, String text, TokenUsage usage, String finishReason, ProviderException error) {
    public StreamEvent {
        Objects.requireNonNull(type, "type must not be null");
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.empty() : usage;
        finishReason = finishReason == null ? "" : finishReason;
    }

    public static StreamEvent start(TokenUsage usage) {
        return new StreamEvent(StreamEventType.START, "", usage, "", null);
    }

    public static StreamEvent delta(String text) {
        return new StreamEvent(StreamEventType.DELTA, text, null, "", null);
    }

    public static StreamEvent stop(TokenUsage usage, String finishReason) {
        return new StreamEvent(StreamEventType.STOP, "", usage, finishReason, null);
    }

    public static StreamEvent error(ProviderException error) {
        return new StreamEvent(StreamEventType.ERROR, "", null, "", Objects.requireNonNull(error, "error must not be null"));
    }
}
