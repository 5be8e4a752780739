package io.mnemo.core.metrics;

import io.mnemo.core.circuit.CircuitState;
import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Observability hooks for every stage of an extraction. Implementations must be thread-safe.
 */
public interface MetricsSink {
    void recordRequest(String provider, String model, String outcome);

    void recordTokens(String provider, String model, int inputTokens, int outputTokens);

    void recordCost(String provider, String model, double costUsd);

    /**
     * @param phase {@code provider} for the round trip, {@code parsing} for repair and validation
     */
    void recordLatency(String provider, String model, String phase, Duration duration);

    void recordCircuitState(String provider, CircuitState state);

    /**
     * Publishes budget utilisation as a gauge read from {@code percent} on every scrape, so a new
     * UTC window shows without waiting for the next call.
     */
    void trackBudgetUtilization(DoubleSupplier percent);

    void recordRepairAttempt(String pass, boolean success);

    void recordFallback(String reason);

    void recordSchemaValidation(boolean valid);

    void recordRateLimitWait(String provider, Duration waited);

    static MetricsSink noop() {
        return NoopMetricsSink.INSTANCE;
    }
}
