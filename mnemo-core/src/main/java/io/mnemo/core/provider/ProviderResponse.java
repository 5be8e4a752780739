package io.mnemo.core.provider;

import io.mnemo.core.model.TokenUsage;

/**
 * Complete, unparsed provider output of a non-streaming call.
 */
public record ProviderResponse(String content, TokenUsage usage, String model, String finishReason) {
    public ProviderResponse {
        content = content == null ? "" : content;
        usage = usage == null ? TokenUsage.empty() : usage;
        model = model == null ? "" : model;
        finishReason = finishReason == null ? "" : finishReason;
    }

    public boolean truncated() {
        return "length".equals(finishReason) || "max_tokens".equals(finishReason);
    }
}
