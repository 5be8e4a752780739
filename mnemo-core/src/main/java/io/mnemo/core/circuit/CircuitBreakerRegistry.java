package io.mnemo.core.circuit;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public final class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final CircuitBreaker.TransitionListener listener;

    public CircuitBreakerRegistry(CircuitBreakerPolicy policy, Clock clock, CircuitBreaker.TransitionListener listener) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener == null ? CircuitBreaker.TransitionListener.NONE : listener;
    }

    public CircuitBreaker breaker(String provider) {
        String key = normalize(provider);
        CircuitBreaker existing = breakers.get(key);
        if (existing != null) {
            return existing;
        }
        CircuitBreaker created = new CircuitBreaker(key, policy, clock, listener);
        CircuitBreaker raced = breakers.putIfAbsent(key, created);
        if (raced != null) {
            return raced;
        }
        listener.onCreated(key, created.state());
        return created;
    }

    public Map<String, CircuitState> states() {
        Map<String, CircuitState> states = new TreeMap<>();
        breakers.forEach((name, breaker) -> states.put(name, breaker.state()));
        return new LinkedHashMap<>(states);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
