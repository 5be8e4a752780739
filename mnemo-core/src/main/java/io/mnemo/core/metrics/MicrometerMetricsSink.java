package io.mnemo.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.mnemo.core.circuit.CircuitState;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

public final class MicrometerMetricsSink implements MetricsSink {
    public static final String REQUESTS = "memory_llm_requests_total";
    public static final String TOKENS = "memory_llm_tokens_total";
    public static final String COST = "memory_llm_cost_usd_total";
    public static final String LATENCY = "memory_llm_latency";
    public static final String CIRCUIT_STATE = "memory_llm_circuit_state";
    public static final String BUDGET_UTILIZATION = "memory_llm_budget_utilization_percent";
    public static final String REPAIR_ATTEMPTS = "memory_llm_repair_attempts_total";
    public static final String FALLBACKS = "memory_llm_fallback_total";
    public static final String SCHEMA_VALIDATIONS = "memory_llm_schema_validation_total";
    public static final String RATE_LIMIT_WAIT = "memory_llm_rate_limit_wait";

    private final MeterRegistry registry;
    private final Map<String, AtomicInteger> circuitStates = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public void recordRequest(String provider, String model, String outcome) {
        Counter.builder(REQUESTS)
            .description("Extraction requests by terminal outcome")
            .tag("provider", safe(provider))
            .tag("model", safe(model))
            .tag("outcome", safe(outcome))
            .register(registry)
            .increment();
    }

    @Override
    public void recordTokens(String provider, String model, int inputTokens, int outputTokens) {
        tokenCounter(provider, model, "input").increment(Math.max(0, inputTokens));
        tokenCounter(provider, model, "output").increment(Math.max(0, outputTokens));
    }

    @Override
    public void recordCost(String provider, String model, double costUsd) {
        Counter.builder(COST)
            .description("Cumulative LLM spend in USD")
            .tag("provider", safe(provider))
            .tag("model", safe(model))
            .register(registry)
            .increment(Math.max(0.0, costUsd));
    }

    @Override
    public void recordLatency(String provider, String model, String phase, Duration duration) {
        Timer.builder(LATENCY)
            .description("Latency of one attempt split by phase")
            .tag("provider", safe(provider))
            .tag("model", safe(model))
            .tag("phase", safe(phase))
            .register(registry)
            .record(duration);
    }

    @Override
    public void recordCircuitState(String provider, CircuitState state) {
        circuitStates.computeIfAbsent(safe(provider), key -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder(CIRCUIT_STATE, holder, AtomicInteger::get)
                .description("Circuit state: 0 closed, 1 open, 2 half open")
                .tag("provider", key)
                .register(registry);
            return holder;
        }).set(state.gaugeValue());
    }

    @Override
    public void trackBudgetUtilization(DoubleSupplier percent) {
        Objects.requireNonNull(percent, "percent must not be null");
        Gauge.builder(BUDGET_UTILIZATION, percent, DoubleSupplier::getAsDouble)
            .description("Share of the daily LLM budget spent in the current UTC window")
            .baseUnit("percent")
            .strongReference(true)
            .register(registry);
    }

    @Override
    public void recordRepairAttempt(String pass, boolean success) {
        Counter.builder(REPAIR_ATTEMPTS)
            .description("Response repair attempts by pass and result")
            .tag("pass", safe(pass))
            .tag("result", success ? "success" : "failure")
            .register(registry)
            .increment();
    }

    @Override
    public void recordFallback(String reason) {
        Counter.builder(FALLBACKS)
            .description("Fallback provider invocations by reason")
            .tag("reason", safe(reason))
            .register(registry)
            .increment();
    }

    @Override
    public void recordSchemaValidation(boolean valid) {
        Counter.builder(SCHEMA_VALIDATIONS)
            .description("Schema validation attempts by result")
            .tag("result", valid ? "valid" : "invalid")
            .register(registry)
            .increment();
    }

    @Override
    public void recordRateLimitWait(String provider, Duration waited) {
        Timer.builder(RATE_LIMIT_WAIT)
            .description("Time spent waiting for rate limiter admission")
            .tag("provider", safe(provider))
            .register(registry)
            .record(waited);
    }

    private Counter tokenCounter(String provider, String model, String direction) {
        return Counter.builder(TOKENS)
            .description("Tokens exchanged with the provider")
            .tag("provider", safe(provider))
            .tag("model", safe(model))
            .tag("direction", direction)
            .register(registry);
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
