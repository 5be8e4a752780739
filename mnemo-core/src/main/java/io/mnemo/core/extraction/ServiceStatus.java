package io.mnemo.core.extraction;

import io.mnemo.core.budget.BudgetState;
import io.mnemo.core.circuit.CircuitState;
import io.mnemo.core.ratelimit.RateLimitSnapshot;
import java.util.List;
import java.util.Map;

public record ServiceStatus(
    String primaryProvider,
    String primaryModel,
    String fallbackProvider,
    BudgetState budget,
    Map<String, CircuitState> circuits,
    List<RateLimitSnapshot> rateLimits
) {
    public ServiceStatus {
        fallbackProvider = fallbackProvider == null ? "" : fallbackProvider;
        circuits = circuits == null ? Map.of() : Map.copyOf(circuits);
        rateLimits = rateLimits == null ? List.of() : List.copyOf(rateLimits);
    }
}
