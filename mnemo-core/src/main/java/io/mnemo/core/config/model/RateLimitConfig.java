package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.ratelimit.RateLimitPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitConfig(
    @JsonAlias({"burst_capacity"}) int capacity,
    @JsonAlias({"refill_per_second", "sustained_rate"}) double refillPerSecond,
    @JsonAlias({"window_seconds"}) int windowSeconds,
    @JsonAlias({"max_per_window", "max_requests_per_window"}) int maxPerWindow,
    @JsonAlias({"max_concurrent", "max_concurrent_requests"}) int maxConcurrent,
    @JsonAlias({"max_queue_depth"}) int maxQueueDepth
) {
    public static RateLimitConfig defaults() {
        return new RateLimitConfig(
            RateLimitPolicy.DEFAULT_CAPACITY,
            RateLimitPolicy.DEFAULT_REFILL_PER_SECOND,
            (int) RateLimitPolicy.DEFAULT_WINDOW.toSeconds(),
            RateLimitPolicy.DEFAULT_MAX_PER_WINDOW,
            RateLimitPolicy.UNLIMITED,
            RateLimitPolicy.UNLIMITED
        );
    }

    public RateLimitPolicy toPolicy() {
        return new RateLimitPolicy(capacity, refillPerSecond, Duration.ofSeconds(windowSeconds), maxPerWindow,
            maxConcurrent, maxQueueDepth);
    }
}
