package io.mnemo.core.retry;

import io.mnemo.core.time.JitterSource;
import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: {@code base * 2^(attempt-1)} capped at {@code max}, plus jitter in
 * {@code [-jitter, +jitter]}, never below zero.
 */
public final class BackoffSchedule {
    public static final Duration DEFAULT_BASE = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX = Duration.ofMillis(8000);
    public static final Duration DEFAULT_JITTER = Duration.ofMillis(200);

    private final Duration base;
    private final Duration max;
    private final Duration jitter;
    private final JitterSource jitterSource;

    public BackoffSchedule(Duration base, Duration max, Duration jitter, JitterSource jitterSource) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
    }

    public BackoffSchedule(JitterSource jitterSource) {
        this(DEFAULT_BASE, DEFAULT_MAX, DEFAULT_JITTER, jitterSource);
    }

    /**
     * Delay before the retry that follows failed attempt number {@code attempt} (1-based).
     */
    public Duration delay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long raw = base.toMillis() << exponent;
        long capped = raw < 0 ? max.toMillis() : Math.min(raw, max.toMillis());
        long jittered = capped + jitterSource.nextJitterMillis(jitter.toMillis());
        return Duration.ofMillis(Math.max(0, jittered));
    }

    /**
     * Same as {@link #delay(int)} but never shorter than a provider's {@code Retry-After} hint,
     * which is itself capped at {@code max}.
     */
    public Duration delay(int attempt, Duration retryAfter) {
        Duration computed = delay(attempt);
        if (retryAfter == null) {
            return computed;
        }
        Duration hint = retryAfter.compareTo(max) > 0 ? max : retryAfter;
        return hint.compareTo(computed) > 0 ? hint : computed;
    }
}
