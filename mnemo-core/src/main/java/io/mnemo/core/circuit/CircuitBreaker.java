package io.mnemo.core.circuit;

import io.github.resilience4j.circuitbreaker.CircuitBreaker.Metrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failure-rate guard for one provider, backed by a count-based Resilience4j state machine running
 * on the injected clock.
 *
 * <p>Every permission remembers the generation it was issued in, and each state transition starts
 * a new generation. Outcomes and releases carrying an older generation are dropped, so a call
 * admitted while closed can never settle a half-open trial it was not part of.
 */
public final class CircuitBreaker {
    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String provider;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final TransitionListener listener;
    private final CircuitBreakerStateMachine delegate;

    private long generation;
    private Instant openedAt;

    public CircuitBreaker(String provider, CircuitBreakerPolicy policy, Clock clock, TransitionListener listener) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener == null ? TransitionListener.NONE : listener;
        this.delegate = new CircuitBreakerStateMachine(provider, policy.toConfig(), clock);
        this.delegate.getEventPublisher().onStateTransition(this::onTransition);
    }

    public CircuitBreaker(String provider, CircuitBreakerPolicy policy, Clock clock) {
        this(provider, policy, clock, TransitionListener.NONE);
    }

    public String provider() {
        return provider;
    }

    /**
     * Asks to place a call. Closed always permits; open permits nothing until the cooldown has
     * elapsed; half-open permits exactly one trial until its outcome is recorded or released.
     */
    public synchronized Optional<Permission> tryAcquirePermission() {
        advanceLocked();
        if (!delegate.tryAcquirePermission()) {
            return Optional.empty();
        }
        return Optional.of(new Permission(generation, delegate.getState() == State.HALF_OPEN));
    }

    /**
     * Returns a permission whose call never reached the provider.
     */
    public synchronized void releasePermission(Permission permission) {
        if (current(permission)) {
            delegate.releasePermission();
        }
    }

    public synchronized void recordSuccess(Permission permission) {
        if (current(permission)) {
            // latency is reported through MetricsSink, the breaker only counts outcomes
            delegate.onSuccess(0, TimeUnit.NANOSECONDS);
        }
    }

    public synchronized void recordFailure(Permission permission, Throwable cause) {
        if (current(permission)) {
            delegate.onError(0, TimeUnit.NANOSECONDS, cause);
        }
    }

    public synchronized CircuitState state() {
        advanceLocked();
        return map(delegate.getState());
    }

    public synchronized double failureRatio() {
        Metrics metrics = delegate.getMetrics();
        int buffered = metrics.getNumberOfBufferedCalls();
        return buffered == 0 ? 0.0 : (double) metrics.getNumberOfFailedCalls() / buffered;
    }

    public synchronized int windowCount() {
        return delegate.getMetrics().getNumberOfBufferedCalls();
    }

    private boolean current(Permission permission) {
        Objects.requireNonNull(permission, "permission must not be null");
        if (permission.generation() != generation) {
            LOG.debug("Dropping outcome for provider={} issued before the last circuit transition", provider);
            return false;
        }
        return true;
    }

    private void advanceLocked() {
        if (delegate.getState() == State.OPEN && openedAt != null
            && !clock.instant().isBefore(openedAt.plus(policy.cooldown()))) {
            delegate.transitionToHalfOpenState();
        }
    }

    // Runs on the thread that triggered the transition, which holds this breaker's lock.
    private void onTransition(CircuitBreakerOnStateTransitionEvent event) {
        CircuitState from = map(event.getStateTransition().getFromState());
        CircuitState to = map(event.getStateTransition().getToState());
        generation++;
        if (to == CircuitState.OPEN) {
            openedAt = clock.instant();
        }
        LOG.info("Circuit for provider={} moved {} -> {} (failure ratio {})", provider, from.code(), to.code(),
            String.format("%.2f", failureRatio()));
        listener.onTransition(provider, from, to);
    }

    private static CircuitState map(State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }

    /**
     * Leave to place one call, issued by {@link #tryAcquirePermission()}.
     *
     * @param trial whether this is the single half-open trial
     */
    public record Permission(long generation, boolean trial) {
    }

    @FunctionalInterface
    public interface TransitionListener {
        TransitionListener NONE = (provider, from, to) -> {
        };

        void onTransition(String provider, CircuitState from, CircuitState to);

        /**
         * Called once when a registry creates the breaker for {@code provider}.
         */
        default void onCreated(String provider, CircuitState state) {
        }
    }
}
