package io.mnemo.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.config.model.CircuitConfig;
import io.mnemo.core.config.model.LlmConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.ProviderConfig;
import io.mnemo.core.config.model.RateLimitConfig;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigValidationTest {

    @Test
    void shouldFlagMissingApiKeyInDefaults() {
        ConfigValidation validation = ConfigValidation.validate(MnemoConfig.defaults());

        assertThat(validation.valid()).isFalse();
        assertThat(validation.errors()).containsExactly("Provider \"claude\" is missing API key");
    }

    @Test
    void shouldAcceptConfiguredPrimaryAndFallback() {
        MnemoConfig config = config(
            new LlmConfig("claude", "openai", 10.0, 3, 60, 30, false, 0.2),
            CircuitConfig.defaults(),
            Map.of()
        );

        assertThat(ConfigValidation.validate(config).valid()).isTrue();
    }

    @Test
    void shouldRejectFallbackEqualToPrimary() {
        MnemoConfig config = config(
            new LlmConfig("claude", "Claude", 0.0, 3, 60, 30, false, 0.2),
            CircuitConfig.defaults(),
            Map.of()
        );

        assertThat(ConfigValidation.validate(config).errors())
            .containsExactly("Fallback provider must differ from the primary provider");
    }

    @Test
    void shouldRejectUnconfiguredProviders() {
        MnemoConfig config = config(
            new LlmConfig("mistral", "gateway", 0.0, 3, 60, 30, false, 0.2),
            CircuitConfig.defaults(),
            Map.of()
        );

        assertThat(ConfigValidation.validate(config).errors()).containsExactly(
            "Primary provider \"mistral\" is not configured",
            "Fallback provider \"gateway\" is not configured"
        );
    }

    @Test
    void shouldCollectEveryNumericProblem() {
        MnemoConfig config = config(
            new LlmConfig("claude", "", -1.0, 0, 0, 30, false, 0.2),
            new CircuitConfig(1.5, 0, 30),
            Map.of("claude", new RateLimitConfig(0, 1.0, 60, 10, -1, 0))
        );

        assertThat(ConfigValidation.validate(config).errors()).containsExactly(
            "Daily budget must be non-negative",
            "Max retries must be at least 1",
            "Call timeout must be positive",
            "Circuit breaker threshold must be between 0 and 1",
            "Circuit breaker probes must be at least 1",
            "Rate limit for \"claude\" must have positive capacity, refill, window and ceiling",
            "Rate limit for \"claude\" must not have a negative concurrency or queue cap"
        );
    }

    @Test
    void shouldRequirePrimaryProvider() {
        MnemoConfig config = config(new LlmConfig(" ", "", 0.0, 3, 60, 30, false, 0.2), CircuitConfig.defaults(), Map.of());

        assertThat(ConfigValidation.validate(config).errors()).containsExactly("Primary provider is required");
    }

    private static MnemoConfig config(LlmConfig llm, CircuitConfig circuit, Map<String, RateLimitConfig> rateLimits) {
        return new MnemoConfig(
            llm,
            circuit,
            Map.of(
                "claude", new ProviderConfig("sk-ant", "", "", "", Map.of()),
                "openai", new ProviderConfig("sk-oai", "", "", "", Map.of())
            ),
            rateLimits,
            null
        );
    }
}
