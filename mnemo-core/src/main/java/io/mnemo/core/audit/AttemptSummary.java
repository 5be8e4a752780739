package io.mnemo.core.audit;

import java.util.Map;

public record AttemptSummary(
    int attempts,
    int successes,
    int failures,
    double successRate,
    double p50LatencyMs,
    double p95LatencyMs,
    double totalCostUsd,
    double averageCostUsd,
    int fallbackAttempts,
    int correctiveAttempts,
    Map<String, Integer> failuresByKind,
    Map<String, Integer> attemptsByProvider
) {
    public AttemptSummary {
        failuresByKind = failuresByKind == null ? Map.of() : Map.copyOf(failuresByKind);
        attemptsByProvider = attemptsByProvider == null ? Map.of() : Map.copyOf(attemptsByProvider);
    }
}
