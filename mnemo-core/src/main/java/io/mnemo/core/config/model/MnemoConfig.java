package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    LlmConfig llm,
    CircuitConfig circuit,
    Map<String, ProviderConfig> providers,
    @JsonAlias({"rate_limits"}) Map<String, RateLimitConfig> rateLimits,
    AuditConfig audit
) {
    public MnemoConfig {
        llm = llm == null ? LlmConfig.defaults() : llm;
        circuit = circuit == null ? CircuitConfig.defaults() : circuit;
        providers = providers == null ? Map.of() : Map.copyOf(providers);
        rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
        audit = audit == null ? AuditConfig.defaults() : audit;
    }

    public static MnemoConfig defaults() {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("claude", ProviderConfig.defaults());
        providers.put("openai", ProviderConfig.defaults());
        Map<String, RateLimitConfig> rateLimits = new LinkedHashMap<>();
        rateLimits.put("claude", RateLimitConfig.defaults());
        rateLimits.put("openai", RateLimitConfig.defaults());
        return new MnemoConfig(LlmConfig.defaults(), CircuitConfig.defaults(), providers, rateLimits, AuditConfig.defaults());
    }

    public ProviderConfig provider(String name) {
        ProviderConfig config = providers.get(name == null ? "" : name.toLowerCase(Locale.ROOT));
        return config == null ? ProviderConfig.defaults() : config;
    }
}
