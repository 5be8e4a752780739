package io.mnemo.core.budget;

/**
 * Estimated spend held against the window between the budget check and the call's completion.
 */
public record BudgetReservation(String id, double amountUsd) {
}
