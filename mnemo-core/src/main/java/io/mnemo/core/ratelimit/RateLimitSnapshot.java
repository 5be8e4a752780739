package io.mnemo.core.ratelimit;

/**
 * @param activeCalls admitted calls not yet released
 * @param maxConcurrent the concurrency cap, 0 when uncapped
 * @param queued callers currently waiting for admission
 * @param tokensGranted bucket tokens handed out so far, which differs from {@code admitted} for
 *     weighted admissions
 */
public record RateLimitSnapshot(
    String provider,
    double availableTokens,
    int callsInWindow,
    long admitted,
    long rejected,
    int activeCalls,
    int maxConcurrent,
    int queued,
    double tokensGranted
) {
}
