package io.mnemo.core.provider;

import java.util.List;

public record ProviderCapabilities(
    int maxInputTokens,
    int maxOutputTokens,
    boolean supportsStreaming,
    boolean jsonMode,
    List<String> supportedModels
) {
    public ProviderCapabilities {
        supportedModels = supportedModels == null ? List.of() : List.copyOf(supportedModels);
    }

    public static ProviderCapabilities none() {
        return new ProviderCapabilities(0, 0, false, false, List.of());
    }
}
