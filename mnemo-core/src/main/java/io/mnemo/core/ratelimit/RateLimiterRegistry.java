package io.mnemo.core.ratelimit;

import io.mnemo.core.time.Sleeper;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link RateLimiter} per provider, created lazily on first use.
 */
public final class RateLimiterRegistry {
    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final Map<String, RateLimitPolicy> policies;
    private final RateLimitPolicy defaultPolicy;
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiterRegistry(
        Map<String, RateLimitPolicy> policies,
        RateLimitPolicy defaultPolicy,
        Clock clock,
        Sleeper sleeper
    ) {
        this.policies = new ConcurrentHashMap<>();
        if (policies != null) {
            policies.forEach((name, policy) -> this.policies.put(normalize(name), policy));
        }
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public RateLimiter limiter(String provider) {
        String key = normalize(provider);
        return limiters.computeIfAbsent(
            key,
            ignored -> new RateLimiter(key, policies.getOrDefault(key, defaultPolicy), clock, sleeper)
        );
    }

    public List<RateLimitSnapshot> snapshots() {
        return limiters.values().stream()
            .map(RateLimiter::snapshot)
            .sorted((a, b) -> a.provider().compareTo(b.provider()))
            .toList();
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
