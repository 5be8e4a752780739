package io.mnemo.core.retry;

import io.mnemo.core.budget.BudgetGuard;
import io.mnemo.core.circuit.CircuitBreakerRegistry;
import io.mnemo.core.ratelimit.RateLimiterRegistry;
import java.util.Objects;

/**
 * The process-wide shared state consulted before every attempt, in this order: budget, circuit,
 * rate limiter.
 */
public record ResilienceGates(BudgetGuard budget, CircuitBreakerRegistry circuits, RateLimiterRegistry limiters) {
    public ResilienceGates {
        Objects.requireNonNull(budget, "budget must not be null");
        Objects.requireNonNull(circuits, "circuits must not be null");
        Objects.requireNonNull(limiters, "limiters must not be null");
    }
}
