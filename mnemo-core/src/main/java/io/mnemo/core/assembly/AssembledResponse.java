package io.mnemo.core.assembly;

import io.mnemo.core.model.TokenUsage;
import io.mnemo.core.provider.ProviderException;

/**
 * Result of draining a stream. {@code error} is set only for {@link AssemblyState#ERRORED}.
 */
public record AssembledResponse(
    AssemblyState state,
    String text,
    TokenUsage usage,
    String finishReason,
    boolean balanced,
    ProviderException error
) {
    public AssembledResponse {
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.empty() : usage;
        finishReason = finishReason == null ? "" : finishReason;
    }
}
