package io.mnemo.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation signal with an optional deadline. Cancelling runs registered callbacks
 * once, which lets in-flight HTTP calls be aborted.
 */
public final class CancellationToken {
    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new ArrayList<>();

    private CancellationToken(Clock clock, Instant deadline) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.deadline = deadline;
    }

    public static CancellationToken none() {
        return new CancellationToken(Clock.systemUTC(), null);
    }

    public static CancellationToken withDeadline(Clock clock, Duration timeout) {
        return new CancellationToken(clock, clock.instant().plus(timeout));
    }

    public static CancellationToken cancellable(Clock clock) {
        return new CancellationToken(clock, null);
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        List<Runnable> snapshot;
        synchronized (callbacks) {
            snapshot = List.copyOf(callbacks);
            callbacks.clear();
        }
        snapshot.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean deadlineExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left until the deadline, or {@code fallback} when no deadline was set.
     */
    public Duration remaining(Duration fallback) {
        if (deadline == null) {
            return fallback;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.isNegative()) {
            return Duration.ZERO;
        }
        return left.compareTo(fallback) < 0 ? left : fallback;
    }

    /**
     * Registers a callback run on cancellation. Runs immediately if already cancelled. The returned
     * handle unregisters it.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled.get()) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> {
        };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
