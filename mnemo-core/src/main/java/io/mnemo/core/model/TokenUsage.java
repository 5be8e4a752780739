package io.mnemo.core.model;

public record TokenUsage(int inputTokens, int outputTokens) {
    public TokenUsage {
        inputTokens = Math.max(0, inputTokens);
        outputTokens = Math.max(0, outputTokens);
    }

    public static TokenUsage empty() {
        return new TokenUsage(0, 0);
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    public boolean reported() {
        return inputTokens > 0 || outputTokens > 0;
    }
}
