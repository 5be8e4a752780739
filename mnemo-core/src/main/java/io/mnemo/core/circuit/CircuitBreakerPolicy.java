package io.mnemo.core.circuit;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * @param failureThreshold ratio of failures in the window above which the circuit opens
 * @param minimumCalls outcomes required in the window before the ratio is evaluated
 * @param cooldown time spent open before a half-open trial is allowed
 * @param windowSize number of most recent outcomes kept
 */
public record CircuitBreakerPolicy(double failureThreshold, int minimumCalls, Duration cooldown, int windowSize) {
    public static final double DEFAULT_FAILURE_THRESHOLD = 0.5;
    public static final int DEFAULT_MINIMUM_CALLS = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);
    public static final int DEFAULT_WINDOW_SIZE = 20;

    // Resilience4j opens at a rate equal to its threshold; the smallest gap between two rates a
    // 20-call window can produce is about 0.26 points, so this margin turns ">=" into ">".
    private static final float EXCEED_MARGIN_PERCENT = 0.01f;

    public CircuitBreakerPolicy {
        if (Double.isNaN(failureThreshold) || failureThreshold < 0.0 || failureThreshold > 1.0) {
            throw new IllegalArgumentException("failureThreshold must be within [0, 1]");
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        minimumCalls = Math.max(1, Math.min(minimumCalls, windowSize));
        cooldown = cooldown == null || cooldown.isNegative() ? DEFAULT_COOLDOWN : cooldown;
    }

    public CircuitBreakerPolicy(double failureThreshold, int minimumCalls, Duration cooldown) {
        this(failureThreshold, minimumCalls, cooldown, DEFAULT_WINDOW_SIZE);
    }

    public static CircuitBreakerPolicy defaults() {
        return new CircuitBreakerPolicy(DEFAULT_FAILURE_THRESHOLD, DEFAULT_MINIMUM_CALLS, DEFAULT_COOLDOWN);
    }

    /**
     * Count-based window with a single half-open trial. A threshold of 1.0 is capped at 100 %, so
     * a window of nothing but failures still opens the circuit.
     */
    CircuitBreakerConfig toConfig() {
        float percent = (float) (failureThreshold * 100.0) + EXCEED_MARGIN_PERCENT;
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(windowSize)
            .minimumNumberOfCalls(minimumCalls)
            .failureRateThreshold(Math.min(100.0f, percent))
            .waitDurationInOpenState(cooldown.toMillis() < 1 ? Duration.ofMillis(1) : cooldown)
            .permittedNumberOfCallsInHalfOpenState(1)
            .currentTimestampFunction(Clock::millis, TimeUnit.MILLISECONDS)
            .build();
    }
}
