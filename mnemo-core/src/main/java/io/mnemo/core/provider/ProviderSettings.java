package io.mnemo.core.provider;

import java.util.Map;

/**
 * Connection settings for one provider. {@code baseUrl} and {@code model} fall back to the
 * provider's defaults when blank.
 */
public record ProviderSettings(
    String apiKey,
    String model,
    String baseUrl,
    String organizationId,
    Map<String, String> extraHeaders
) {
    public ProviderSettings {
        apiKey = apiKey == null ? "" : apiKey.trim();
        model = model == null ? "" : model.trim();
        baseUrl = baseUrl == null ? "" : baseUrl.trim();
        organizationId = organizationId == null ? "" : organizationId.trim();
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public ProviderSettings(String apiKey, String model, String baseUrl) {
        this(apiKey, model, baseUrl, "", Map.of());
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    public String modelOr(String fallback) {
        return model.isBlank() ? fallback : model;
    }

    public String baseUrlOr(String fallback) {
        return baseUrl.isBlank() ? fallback : baseUrl;
    }
}
