package io.mnemo.core.metrics;

import io.mnemo.core.circuit.CircuitState;
import java.time.Duration;
import java.util.function.DoubleSupplier;

final class NoopMetricsSink implements MetricsSink {
    static final NoopMetricsSink INSTANCE = new NoopMetricsSink();

    private NoopMetricsSink() {
    }

    @Override
    public void recordRequest(String provider, String model, String outcome) {
    }

    @Override
    public void recordTokens(String provider, String model, int inputTokens, int outputTokens) {
    }

    @Override
    public void recordCost(String provider, String model, double costUsd) {
    }

    @Override
    public void recordLatency(String provider, String model, String phase, Duration duration) {
    }

    @Override
    public void recordCircuitState(String provider, CircuitState state) {
    }

    @Override
    public void trackBudgetUtilization(DoubleSupplier percent) {
    }

    @Override
    public void recordRepairAttempt(String pass, boolean success) {
    }

    @Override
    public void recordFallback(String reason) {
    }

    @Override
    public void recordSchemaValidation(boolean valid) {
    }

    @Override
    public void recordRateLimitWait(String provider, Duration waited) {
    }
}
