package io.mnemo.core.budget;

public final class BudgetBlockedException extends RuntimeException {
    private final double projectedUsd;
    private final double dailyLimitUsd;

    public BudgetBlockedException(double projectedUsd, double dailyLimitUsd) {
        super(String.format("Daily budget exceeded: projected $%.4f over limit $%.2f", projectedUsd, dailyLimitUsd));
        this.projectedUsd = projectedUsd;
        this.dailyLimitUsd = dailyLimitUsd;
    }

    public double projectedUsd() {
        return projectedUsd;
    }

    public double dailyLimitUsd() {
        return dailyLimitUsd;
    }
}
