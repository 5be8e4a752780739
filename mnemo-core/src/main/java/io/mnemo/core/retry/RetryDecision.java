package io.mnemo.core.retry;

public enum RetryDecision {
    RETRY,
    CORRECTIVE_RETRY,
    FALLBACK,
    FAIL
}
