package io.mnemo.core.retry;

/**
 * Attempt caps and fallback eligibility. {@link #decide} is a pure function of the failure and the
 * attempt counters so it can be tested without timers or I/O.
 *
 * @param maxTransportAttempts attempts per provider shared by rate_limit, timeout and transient
 * @param maxCorrectiveRetries JSON-only retries after a parsing failure
 * @param fallbackOnInvalidRequest whether invalid_request may move to the fallback provider
 */
public record RetryPolicy(int maxTransportAttempts, int maxCorrectiveRetries, boolean fallbackOnInvalidRequest) {
    public static final int DEFAULT_TRANSPORT_ATTEMPTS = 3;

    public RetryPolicy {
        maxTransportAttempts = Math.max(1, maxTransportAttempts);
        maxCorrectiveRetries = Math.max(0, maxCorrectiveRetries);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_TRANSPORT_ATTEMPTS, 1, false);
    }

    /**
     * @param kind classification of the failure just observed
     * @param transportFailures transport failures so far on the current provider, this one included
     * @param correctiveRetries corrective retries already made on the current provider
     * @param fallbackAvailable whether a fallback provider is configured and unused
     * @param onFallback whether the failure came from the fallback provider
     */
    public RetryDecision decide(
        ErrorKind kind,
        int transportFailures,
        int correctiveRetries,
        boolean fallbackAvailable,
        boolean onFallback
    ) {
        if (onFallback) {
            return RetryDecision.FAIL;
        }
        if (kind.transport()) {
            if (transportFailures < maxTransportAttempts) {
                return RetryDecision.RETRY;
            }
            return fallbackAvailable ? RetryDecision.FALLBACK : RetryDecision.FAIL;
        }
        if (kind == ErrorKind.PARSING) {
            if (correctiveRetries < maxCorrectiveRetries) {
                return RetryDecision.CORRECTIVE_RETRY;
            }
            return fallbackAvailable ? RetryDecision.FALLBACK : RetryDecision.FAIL;
        }
        if (kind == ErrorKind.INVALID_REQUEST && fallbackOnInvalidRequest && fallbackAvailable) {
            return RetryDecision.FALLBACK;
        }
        return RetryDecision.FAIL;
    }
}
