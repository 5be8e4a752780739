package io.mnemo.core.retry;

public enum ExtractionOutcome {
    SUCCESS,
    FALLBACK_SUCCESS,
    ERROR,
    CIRCUIT_OPEN,
    BUDGET_BLOCKED,
    CANCELLED
}
