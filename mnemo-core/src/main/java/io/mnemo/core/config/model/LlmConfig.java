package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Provider selection and per-call limits. A blank {@code fallbackProvider} means no fallback;
 * {@code dailyBudgetUsd} of 0 disables the budget gate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmConfig(
    @JsonAlias({"primary_provider", "primary"}) String primaryProvider,
    @JsonAlias({"fallback_provider", "fallback"}) String fallbackProvider,
    @JsonAlias({"daily_budget_usd"}) double dailyBudgetUsd,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"call_timeout_seconds"}) int callTimeoutSeconds,
    @JsonAlias({"admission_timeout_seconds"}) int admissionTimeoutSeconds,
    boolean streaming,
    double temperature
) {
    public LlmConfig {
        primaryProvider = primaryProvider == null ? "" : primaryProvider.trim();
        fallbackProvider = fallbackProvider == null ? "" : fallbackProvider.trim();
    }

    public static LlmConfig defaults() {
        return new LlmConfig("claude", "", 0.0, 3, 60, 30, false, 0.2);
    }

    public boolean hasFallback() {
        return !fallbackProvider.isBlank();
    }
}
