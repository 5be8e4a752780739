package io.mnemo.core.provider;

import io.mnemo.core.model.ChatMessage;
import java.time.Duration;
import java.util.List;

/**
 * Wire-level request handed to a {@link ProviderClient}. {@code timeout} bounds the whole call.
 */
public record ProviderRequest(List<ChatMessage> messages, int maxTokens, double temperature, Duration timeout) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public ProviderRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        maxTokens = Math.max(1, maxTokens);
        temperature = Double.isNaN(temperature) ? 0.0 : Math.max(0.0, temperature);
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    public String promptText() {
        StringBuilder text = new StringBuilder();
        for (ChatMessage message : messages) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(message.content());
        }
        return text.toString();
    }
}
