package io.mnemo.core.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mnemo.core.Fixtures;
import io.mnemo.core.circuit.CircuitState;
import io.mnemo.core.config.model.AuditConfig;
import io.mnemo.core.config.model.CircuitConfig;
import io.mnemo.core.config.model.LlmConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.ProviderConfig;
import io.mnemo.core.merge.PriorMemoryLookup;
import io.mnemo.core.metrics.MetricsSink;
import io.mnemo.core.metrics.MicrometerMetricsSink;
import io.mnemo.core.model.AttemptRecord;
import io.mnemo.core.provider.ProviderException;
import io.mnemo.core.provider.ProviderFactory;
import io.mnemo.core.provider.ScriptedProvider;
import io.mnemo.core.retry.ErrorKind;
import io.mnemo.core.retry.ExtractionOutcome;
import io.mnemo.core.retry.ExtractionReport;
import io.mnemo.core.time.JitterSource;
import io.mnemo.core.time.MutableClock;
import io.mnemo.core.time.RecordingSleeper;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryExtractionServiceTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final ScriptedProvider primary = new ScriptedProvider("claude", 0.0001);
    private final ScriptedProvider fallback = new ScriptedProvider("openai");

    @Test
    void shouldExtractAndAppendAttemptsToAuditLog() throws Exception {
        primary.reply(Fixtures.VALID_RESPONSE);
        MemoryExtractionService service = service(config("openai", true), null);

        ExtractionReport report = service.extract(Fixtures.request());

        assertThat(report.outcome()).isEqualTo(ExtractionOutcome.SUCCESS);
        assertThat(report.result().memories()).hasSize(1);
        assertThat(report.result().memories().get(0).confidence()).isEqualTo(0.8);
        assertThat(service.auditor().recent(10))
            .extracting(AttemptRecord::provider, AttemptRecord::outcome)
            .containsExactly(tuple("claude", "success"));
        assertThat(tempDir.resolve("attempts.json")).exists();
    }

    @Test
    void shouldFallBackAndAuditEveryAttempt() throws Exception {
        primary.failTimes(3, new ProviderException(ErrorKind.TIMEOUT, "read timed out"));
        fallback.reply(Fixtures.VALID_RESPONSE);
        MemoryExtractionService service = service(config("openai", true), null);

        ExtractionReport report = service.extract(Fixtures.request());

        assertThat(report.outcome()).isEqualTo(ExtractionOutcome.FALLBACK_SUCCESS);
        assertThat(report.provider()).isEqualTo("openai");
        assertThat(service.auditor().summary().attempts()).isEqualTo(4);
        assertThat(service.auditor().summary().fallbackAttempts()).isEqualTo(1);
        assertThat(service.auditor().summary().failuresByKind()).containsEntry("timeout", 3);
    }

    @Test
    void shouldMergeConfidenceWithPriorExtraction() {
        primary.reply(Fixtures.VALID_RESPONSE);
        MemoryExtractionService service = service(config("", false), memory -> OptionalDouble.of(0.4));

        ExtractionReport report = service.extract(Fixtures.request());

        assertThat(report.succeeded()).isTrue();
        assertThat(report.result().memories().get(0).confidence()).isCloseTo(0.5333, within(1e-4));
        assertThat(service.auditor()).isNull();
    }

    @Test
    void shouldReportStatusOfConfiguredStack() {
        MemoryExtractionService service = service(config("openai", false), null);

        ServiceStatus status = service.status();

        assertThat(status.primaryProvider()).isEqualTo("claude");
        assertThat(status.primaryModel()).isEqualTo("claude-model");
        assertThat(status.fallbackProvider()).isEqualTo("openai");
        assertThat(status.budget().dailyLimitUsd()).isEqualTo(10.0);
        assertThat(status.circuits().getOrDefault("claude", CircuitState.CLOSED)).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void shouldRejectInvalidConfigurationWithEveryProblem() {
        MnemoConfig config = new MnemoConfig(
            new LlmConfig("claude", "claude", -1.0, 3, 60, 30, false, 0.2),
            CircuitConfig.defaults(),
            Map.of(),
            Map.of(),
            null
        );

        assertThatThrownBy(() -> service(config, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("Invalid memory LLM configuration: ")
            .hasMessageContaining("Primary provider \"claude\" is not configured")
            .hasMessageContaining("Fallback provider must differ from the primary provider")
            .hasMessageContaining("Daily budget must be non-negative");
    }

    @Test
    void shouldRejectProviderMissingFromFactory() {
        MnemoConfig config = new MnemoConfig(
            new LlmConfig("mistral", "", 0.0, 3, 60, 30, false, 0.2),
            CircuitConfig.defaults(),
            Map.of("mistral", new ProviderConfig("key", "", "", "", Map.of())),
            Map.of(),
            new AuditConfig(false, "", 10)
        );

        assertThatThrownBy(() -> service(config, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Unknown provider: mistral");
    }

    @Test
    void shouldPublishCircuitAndBudgetGaugesFromStartup() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        primary.reply(Fixtures.VALID_RESPONSE);
        MemoryExtractionService service = service(config("openai", false), null, new MicrometerMetricsSink(registry));

        assertThat(registry.get(MicrometerMetricsSink.CIRCUIT_STATE).tag("provider", "claude").gauge().value()).isZero();
        assertThat(registry.get(MicrometerMetricsSink.CIRCUIT_STATE).tag("provider", "openai").gauge().value()).isZero();
        assertThat(registry.get(MicrometerMetricsSink.BUDGET_UTILIZATION).gauge().value()).isZero();

        service.extract(Fixtures.request());
        // 150 scripted tokens at $0.0001 against a $10 limit
        assertThat(registry.get(MicrometerMetricsSink.BUDGET_UTILIZATION).gauge().value()).isCloseTo(0.15, within(1e-9));

        clock.advance(Duration.ofDays(1));

        assertThat(registry.get(MicrometerMetricsSink.BUDGET_UTILIZATION).gauge().value()).isZero();
    }

    private MemoryExtractionService service(MnemoConfig config, PriorMemoryLookup lookup) {
        return service(config, lookup, MetricsSink.noop());
    }

    private MemoryExtractionService service(MnemoConfig config, PriorMemoryLookup lookup, MetricsSink metrics) {
        ProviderFactory factory = new ProviderFactory();
        factory.register("claude", () -> primary);
        factory.register("openai", () -> fallback);
        return MemoryExtractionService.fromConfig(config, factory, metrics, lookup, clock, sleeper, JitterSource.none());
    }

    private MnemoConfig config(String fallbackProvider, boolean audit) {
        return new MnemoConfig(
            new LlmConfig("claude", fallbackProvider, 10.0, 3, 60, 30, false, 0.2),
            CircuitConfig.defaults(),
            Map.of(
                "claude", new ProviderConfig("sk-ant", "", "", "", Map.of()),
                "openai", new ProviderConfig("sk-oai", "", "", "", Map.of())
            ),
            Map.of(),
            new AuditConfig(audit, tempDir.resolve("attempts.json").toString(), 100)
        );
    }
}
