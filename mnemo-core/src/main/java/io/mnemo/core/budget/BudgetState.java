package io.mnemo.core.budget;

import java.time.LocalDate;

/**
 * Snapshot of the current UTC-day spend window.
 */
public record BudgetState(
    LocalDate windowStartUtc,
    double spentUsd,
    double reservedUsd,
    double dailyLimitUsd,
    long rolloverCount
) {
    public boolean enabled() {
        return dailyLimitUsd > 0;
    }

    public double remainingUsd() {
        if (!enabled()) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, dailyLimitUsd - spentUsd - reservedUsd);
    }

    public double utilizationPercent() {
        if (!enabled()) {
            return 0.0;
        }
        return spentUsd / dailyLimitUsd * 100.0;
    }
}
