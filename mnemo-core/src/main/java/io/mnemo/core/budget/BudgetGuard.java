package io.mnemo.core.budget;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daily spend cap over a fixed UTC-day window. The window rolls over lazily on the first access
 * after midnight; spend within a window only grows.
 */
public final class BudgetGuard {
    private static final Logger LOG = LoggerFactory.getLogger(BudgetGuard.class);
    private static final List<Integer> WARNING_THRESHOLDS = List.of(70, 90, 100);

    private final double dailyLimitUsd;
    private final Clock clock;
    private final Map<String, Double> reservations = new LinkedHashMap<>();
    private final TreeSet<Integer> warned = new TreeSet<>();

    private LocalDate windowStart;
    private double spentUsd;
    private long rolloverCount;

    public BudgetGuard(double dailyLimitUsd, Clock clock) {
        this.dailyLimitUsd = Math.max(0.0, dailyLimitUsd);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windowStart = today();
    }

    public boolean enabled() {
        return dailyLimitUsd > 0;
    }

    /**
     * Checks that {@code estimatedUsd} fits in what is left of the window and holds it until
     * {@link #commit} or {@link #release}.
     *
     * @throws BudgetBlockedException when the projected spend exceeds the daily limit
     */
    public synchronized BudgetReservation checkAndReserve(double estimatedUsd) {
        rolloverIfNeeded();
        double amount = Math.max(0.0, estimatedUsd);
        double projected = spentUsd + reservedLocked() + amount;
        if (enabled() && projected > dailyLimitUsd) {
            LOG.warn("Budget gate blocked call: projected ${} over daily limit ${}", round4(projected), dailyLimitUsd);
            throw new BudgetBlockedException(projected, dailyLimitUsd);
        }
        BudgetReservation reservation = new BudgetReservation(UUID.randomUUID().toString(), amount);
        reservations.put(reservation.id(), amount);
        return reservation;
    }

    /**
     * Replaces the reservation with the call's actual cost.
     */
    public synchronized void commit(BudgetReservation reservation, double actualUsd) {
        rolloverIfNeeded();
        if (reservation != null) {
            reservations.remove(reservation.id());
        }
        spentUsd += Math.max(0.0, actualUsd);
        warnOnThresholds();
    }

    public synchronized void release(BudgetReservation reservation) {
        if (reservation != null) {
            reservations.remove(reservation.id());
        }
    }

    public synchronized BudgetState state() {
        rolloverIfNeeded();
        return new BudgetState(windowStart, spentUsd, reservedLocked(), dailyLimitUsd, rolloverCount);
    }

    public synchronized double utilizationPercent() {
        return state().utilizationPercent();
    }

    /**
     * Warning thresholds (percent) already crossed in the current window.
     */
    public synchronized List<Integer> thresholdsReached() {
        rolloverIfNeeded();
        return List.copyOf(warned);
    }

    private void rolloverIfNeeded() {
        LocalDate today = today();
        if (!today.isAfter(windowStart)) {
            return;
        }
        LOG.info("Budget window rolled over from {} to {} (spent ${})", windowStart, today, round4(spentUsd));
        windowStart = today;
        spentUsd = 0.0;
        warned.clear();
        rolloverCount++;
    }

    private void warnOnThresholds() {
        if (!enabled()) {
            return;
        }
        double percent = spentUsd / dailyLimitUsd * 100.0;
        for (int threshold : WARNING_THRESHOLDS) {
            if (percent >= threshold && warned.add(threshold)) {
                LOG.warn("Daily LLM budget at {}% (${} of ${})", threshold, round4(spentUsd), dailyLimitUsd);
            }
        }
    }

    private double reservedLocked() {
        double total = 0.0;
        for (double value : reservations.values()) {
            total += value;
        }
        return total;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
