package io.mnemo.core.ratelimit;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.mnemo.core.provider.ProviderException;
import io.mnemo.core.time.CancellationToken;
import io.mnemo.core.time.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-provider admission control. A call is admitted only when the bucket holds its weight in
 * tokens, the trailing window is below its ceiling and a concurrency slot is free; all three are
 * debited in the same critical section. Every admission holds its slot until {@link #release()}.
 */
public final class RateLimiter {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);

    // No wake-up signal exists for a freed slot, so waiters poll at this interval.
    static final Duration CONCURRENCY_POLL = Duration.ofMillis(50);

    private final String provider;
    private final RateLimitPolicy policy;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Bulkhead concurrency;
    private final Deque<Instant> admissions = new ArrayDeque<>();

    private double tokens;
    private Instant lastRefill;
    private long admitted;
    private long rejected;
    private int active;
    private int queued;
    private double tokensGranted;

    public RateLimiter(String provider, RateLimitPolicy policy, Clock clock, Sleeper sleeper) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.concurrency = policy.concurrencyCapped()
            ? Bulkhead.of(provider, BulkheadConfig.custom()
                .maxConcurrentCalls(policy.maxConcurrent())
                .maxWaitDuration(Duration.ZERO)
                .build())
            : null;
        this.tokens = policy.capacity();
        this.lastRefill = clock.instant();
    }

    public String provider() {
        return provider;
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    /**
     * Admits one call if all constraints allow it right now. Never waits.
     */
    public boolean tryAcquire() {
        return tryAcquire(1.0);
    }

    /**
     * Admits one call debiting {@code weight} bucket tokens. Never waits.
     *
     * @throws IllegalArgumentException when {@code weight} is not positive or exceeds the capacity
     */
    public synchronized boolean tryAcquire(double weight) {
        checkWeight(weight);
        if (admitLocked(clock.instant(), weight)) {
            return true;
        }
        rejected++;
        return false;
    }

    public Duration acquire(Duration timeout, CancellationToken token) {
        return acquire(1.0, timeout, token);
    }

    /**
     * Blocks until a call weighing {@code weight} tokens is admitted.
     *
     * @return how long the caller waited
     * @throws ProviderException with kind {@code rate_limit}, marked local, when admission cannot
     *     happen within {@code timeout} or the wait queue is full
     * @throws CancellationException when {@code token} is cancelled while waiting
     */
    public Duration acquire(double weight, Duration timeout, CancellationToken token) {
        checkWeight(weight);
        Instant start = clock.instant();
        Instant deadline = start.plus(timeout);
        boolean waiting = false;
        try {
            while (true) {
                if (token.isCancelled()) {
                    throw new CancellationException("Rate limiter wait cancelled for " + provider);
                }
                Instant now = clock.instant();
                Duration wait;
                synchronized (this) {
                    if (admitLocked(now, weight)) {
                        return Duration.between(start, now);
                    }
                    if (!waiting) {
                        if (policy.queueCapped() && queued >= policy.maxQueueDepth()) {
                            rejected++;
                            LOG.warn("Rate limit queue full for provider={} ({} waiting)", provider, queued);
                            throw ProviderException.localRateLimit(
                                "Rate limiter queue for " + provider + " is full (" + policy.maxQueueDepth() + " waiting)"
                            );
                        }
                        queued++;
                        waiting = true;
                    }
                    wait = waitLocked(now, weight);
                    Duration left = Duration.between(now, deadline);
                    // Waits only grow under contention, so a wait beyond the deadline cannot succeed.
                    if (left.isNegative() || left.isZero() || wait.compareTo(left) > 0) {
                        rejected++;
                        LOG.warn("Rate limit admission timed out for provider={} after {} ms", provider,
                            Duration.between(start, now).toMillis());
                        throw ProviderException.localRateLimit(
                            "Rate limiter for " + provider + " could not admit a call within " + timeout.toMillis() + " ms"
                        );
                    }
                }
                LOG.debug("Waiting {} ms for rate limiter admission provider={}", wait.toMillis(), provider);
                if (!sleeper.sleep(wait, token)) {
                    throw new CancellationException("Rate limiter wait cancelled for " + provider);
                }
            }
        } finally {
            if (waiting) {
                synchronized (this) {
                    queued--;
                }
            }
        }
    }

    /**
     * Frees the concurrency slot held by one admission. Extra releases are ignored.
     */
    public synchronized void release() {
        if (active == 0) {
            return;
        }
        active--;
        if (concurrency != null) {
            concurrency.onComplete();
        }
    }

    public synchronized RateLimitSnapshot snapshot() {
        Instant now = clock.instant();
        refillLocked(now);
        pruneLocked(now);
        return new RateLimitSnapshot(provider, tokens, admissions.size(), admitted, rejected, active,
            policy.maxConcurrent(), queued, tokensGranted);
    }

    private void checkWeight(double weight) {
        if (Double.isNaN(weight) || weight <= 0 || weight > policy.capacity()) {
            throw new IllegalArgumentException(
                "weight must be positive and at most the bucket capacity " + policy.capacity() + " but was " + weight
            );
        }
    }

    private boolean admitLocked(Instant now, double weight) {
        refillLocked(now);
        pruneLocked(now);
        if (tokens < weight || admissions.size() >= policy.maxPerWindow()) {
            return false;
        }
        if (concurrency != null && !concurrency.tryAcquirePermission()) {
            return false;
        }
        tokens -= weight;
        tokensGranted += weight;
        admissions.addLast(now);
        admitted++;
        active++;
        return true;
    }

    private Duration waitLocked(Instant now, double weight) {
        long tokenWaitMs = 0;
        if (tokens < weight) {
            tokenWaitMs = (long) Math.ceil((weight - tokens) / policy.refillPerSecond() * 1000.0);
        }
        long windowWaitMs = 0;
        if (admissions.size() >= policy.maxPerWindow()) {
            Instant oldestExpiry = admissions.peekFirst().plus(policy.window());
            windowWaitMs = Math.max(1, Duration.between(now, oldestExpiry).toMillis());
        }
        long waitMs = Math.max(tokenWaitMs, windowWaitMs);
        if (waitMs == 0) {
            // bucket and window allow the call, so only the concurrency cap is in the way
            return CONCURRENCY_POLL;
        }
        return Duration.ofMillis(waitMs);
    }

    private void refillLocked(Instant now) {
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos <= 0) {
            return;
        }
        tokens = Math.min(policy.capacity(), tokens + elapsedNanos / 1_000_000_000.0 * policy.refillPerSecond());
        lastRefill = now;
    }

    private void pruneLocked(Instant now) {
        Instant cutoff = now.minus(policy.window());
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(cutoff)) {
            admissions.removeFirst();
        }
    }
}
