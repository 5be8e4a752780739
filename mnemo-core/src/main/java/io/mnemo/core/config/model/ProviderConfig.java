package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.provider.ProviderSettings;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    String model,
    @JsonAlias({"base_url", "api_base"}) String baseUrl,
    @JsonAlias({"organization_id", "org_id"}) String organizationId,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {
    public ProviderConfig {
        apiKey = apiKey == null ? "" : apiKey;
        model = model == null ? "" : model;
        baseUrl = baseUrl == null ? "" : baseUrl;
        organizationId = organizationId == null ? "" : organizationId;
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig("", "", "", "", Map.of());
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    public ProviderSettings toSettings() {
        return new ProviderSettings(apiKey, model, baseUrl, organizationId, extraHeaders);
    }
}
