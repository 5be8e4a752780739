package io.mnemo.core.config;

import io.mnemo.core.config.model.CircuitConfig;
import io.mnemo.core.config.model.LlmConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.ProviderConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code MEMORY_LLM_*} variables over file configuration. Unparseable numbers keep the
 * configured value.
 */
public final class EnvironmentOverrides {
    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentOverrides.class);

    public static final String PRIMARY = "MEMORY_LLM_PRIMARY";
    public static final String FALLBACK = "MEMORY_LLM_FALLBACK";
    public static final String DAILY_BUDGET_USD = "MEMORY_LLM_DAILY_BUDGET_USD";
    public static final String MAX_RETRIES = "MEMORY_LLM_MAX_RETRIES";
    public static final String CIRCUIT_THRESHOLD = "MEMORY_LLM_CIRCUIT_THRESHOLD";
    public static final String CIRCUIT_PROBES = "MEMORY_LLM_CIRCUIT_PROBES";
    public static final String CALL_TIMEOUT_SECONDS = "MEMORY_LLM_CALL_TIMEOUT_SECONDS";
    public static final String API_KEY_PREFIX = "MEMORY_LLM_API_KEY_";
    public static final String MODEL_PREFIX = "MEMORY_LLM_MODEL_";
    public static final String BASE_URL_PREFIX = "MEMORY_LLM_BASE_URL_";
    public static final String ORG_ID_PREFIX = "MEMORY_LLM_ORG_ID_";

    private static final List<String> KNOWN_PROVIDERS = List.of("claude", "openai");

    private final Map<String, String> environment;

    public EnvironmentOverrides(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public MnemoConfig apply(MnemoConfig config) {
        LlmConfig llm = config.llm();
        String primary = text(PRIMARY).map(EnvironmentOverrides::normalize).orElse(llm.primaryProvider());
        String fallback = text(FALLBACK).map(EnvironmentOverrides::normalizeFallback).orElse(llm.fallbackProvider());
        LlmConfig overriddenLlm = new LlmConfig(
            primary,
            fallback,
            number(DAILY_BUDGET_USD, llm.dailyBudgetUsd()),
            (int) number(MAX_RETRIES, llm.maxRetries()),
            (int) number(CALL_TIMEOUT_SECONDS, llm.callTimeoutSeconds()),
            llm.admissionTimeoutSeconds(),
            llm.streaming(),
            llm.temperature()
        );

        CircuitConfig circuit = config.circuit();
        CircuitConfig overriddenCircuit = new CircuitConfig(
            number(CIRCUIT_THRESHOLD, circuit.threshold()),
            (int) number(CIRCUIT_PROBES, circuit.probes()),
            circuit.cooldownSeconds()
        );

        Map<String, ProviderConfig> providers = new LinkedHashMap<>(config.providers());
        for (String name : KNOWN_PROVIDERS) {
            ProviderConfig current = providers.getOrDefault(name, ProviderConfig.defaults());
            String suffix = name.toUpperCase(Locale.ROOT);
            providers.put(name, new ProviderConfig(
                text(API_KEY_PREFIX + suffix).orElse(current.apiKey()),
                text(MODEL_PREFIX + suffix).orElse(current.model()),
                text(BASE_URL_PREFIX + suffix).orElse(current.baseUrl()),
                text(ORG_ID_PREFIX + suffix).orElse(current.organizationId()),
                current.extraHeaders()
            ));
        }

        return new MnemoConfig(overriddenLlm, overriddenCircuit, providers, config.rateLimits(), config.audit());
    }

    private Optional<String> text(String key) {
        String value = environment.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private double number(String key, double current) {
        String value = environment.get(key);
        if (value == null || value.isBlank()) {
            return current;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring {}={}: not a number", key, value);
            return current;
        }
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizeFallback(String name) {
        String normalized = normalize(name);
        return "none".equals(normalized) ? "" : normalized;
    }
}
