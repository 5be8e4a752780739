package io.mnemo.core.pricing;

import io.mnemo.core.model.TokenUsage;

/**
 * Character-based token approximation used before a call; provider-reported usage replaces it
 * afterwards.
 */
public final class TokenEstimator {
    private static final double DEFAULT_CHARS_PER_TOKEN = 4.0;

    private final double charsPerToken;

    public TokenEstimator() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    public TokenEstimator(double charsPerToken) {
        this.charsPerToken = charsPerToken <= 0 ? DEFAULT_CHARS_PER_TOKEN : charsPerToken;
    }

    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / charsPerToken);
    }

    public TokenUsage reconcile(TokenUsage estimated, TokenUsage reported) {
        if (reported != null && reported.reported()) {
            int input = reported.inputTokens() > 0 ? reported.inputTokens() : estimated.inputTokens();
            return new TokenUsage(input, reported.outputTokens());
        }
        return estimated;
    }
}
