package io.mnemo.core.config;

import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.ProviderConfig;
import java.util.ArrayList;
import java.util.List;

public record ConfigValidation(List<String> errors) {
    public ConfigValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public static ConfigValidation validate(MnemoConfig config) {
        List<String> errors = new ArrayList<>();
        String primary = config.llm().primaryProvider();
        if (primary.isBlank()) {
            errors.add("Primary provider is required");
        } else {
            requireProvider(config, primary, "Primary", errors);
        }
        String fallback = config.llm().fallbackProvider();
        if (!fallback.isBlank()) {
            if (fallback.equalsIgnoreCase(primary)) {
                errors.add("Fallback provider must differ from the primary provider");
            } else {
                requireProvider(config, fallback, "Fallback", errors);
            }
        }
        if (config.llm().dailyBudgetUsd() < 0) {
            errors.add("Daily budget must be non-negative");
        }
        if (config.llm().maxRetries() < 1) {
            errors.add("Max retries must be at least 1");
        }
        if (config.llm().callTimeoutSeconds() <= 0) {
            errors.add("Call timeout must be positive");
        }
        double threshold = config.circuit().threshold();
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 1) {
            errors.add("Circuit breaker threshold must be between 0 and 1");
        }
        if (config.circuit().probes() < 1) {
            errors.add("Circuit breaker probes must be at least 1");
        }
        config.rateLimits().forEach((name, limit) -> {
            if (limit.capacity() < 1 || limit.refillPerSecond() <= 0 || limit.windowSeconds() < 1 || limit.maxPerWindow() < 1) {
                errors.add("Rate limit for \"" + name + "\" must have positive capacity, refill, window and ceiling");
            }
            if (limit.maxConcurrent() < 0 || limit.maxQueueDepth() < 0) {
                errors.add("Rate limit for \"" + name + "\" must not have a negative concurrency or queue cap");
            }
        });
        return new ConfigValidation(errors);
    }

    private static void requireProvider(MnemoConfig config, String name, String role, List<String> errors) {
        if (!config.providers().containsKey(name)) {
            errors.add(role + " provider \"" + name + "\" is not configured");
            return;
        }
        ProviderConfig provider = config.providers().get(name);
        if (!provider.configured()) {
            errors.add("Provider \"" + name + "\" is missing API key");
        }
    }
}
