package io.mnemo.core.ratelimit;

import java.time.Duration;

/**
 * Token bucket of {@code capacity} refilled at {@code refillPerSecond}, combined with a ceiling of
 * {@code maxPerWindow} admissions in any trailing {@code window}.
 *
 * @param maxConcurrent calls allowed in flight at once, 0 for no cap
 * @param maxQueueDepth callers allowed to wait for admission at once, 0 for no cap; callers beyond
 *     it are rejected straight away
 */
public record RateLimitPolicy(
    int capacity,
    double refillPerSecond,
    Duration window,
    int maxPerWindow,
    int maxConcurrent,
    int maxQueueDepth
) {
    public static final int DEFAULT_CAPACITY = 10;
    public static final double DEFAULT_REFILL_PER_SECOND = 1.0;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_PER_WINDOW = 50;
    public static final int UNLIMITED = 0;

    public RateLimitPolicy {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (refillPerSecond <= 0 || Double.isNaN(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxPerWindow < 1) {
            throw new IllegalArgumentException("maxPerWindow must be at least 1");
        }
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException("maxConcurrent must not be negative");
        }
        if (maxQueueDepth < 0) {
            throw new IllegalArgumentException("maxQueueDepth must not be negative");
        }
    }

    public RateLimitPolicy(int capacity, double refillPerSecond, Duration window, int maxPerWindow) {
        this(capacity, refillPerSecond, window, maxPerWindow, UNLIMITED, UNLIMITED);
    }

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(DEFAULT_CAPACITY, DEFAULT_REFILL_PER_SECOND, DEFAULT_WINDOW, DEFAULT_MAX_PER_WINDOW);
    }

    public boolean concurrencyCapped() {
        return maxConcurrent > 0;
    }

    public boolean queueCapped() {
        return maxQueueDepth > 0;
    }
}
