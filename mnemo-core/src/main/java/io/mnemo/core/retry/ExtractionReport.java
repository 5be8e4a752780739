package io.mnemo.core.retry;

import io.mnemo.core.model.AttemptRecord;
import io.mnemo.core.model.ExtractionResult;
import io.mnemo.core.repair.RepairPass;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one extraction: a validated result or exactly one classified failure, plus
 * every provider attempt made on the way.
 */
public record ExtractionReport(
    String requestId,
    ExtractionOutcome outcome,
    ErrorKind errorKind,
    ExtractionResult result,
    String provider,
    String model,
    RepairPass repairPass,
    String message,
    List<AttemptRecord> attempts
) {
    public ExtractionReport {
        Objects.requireNonNull(outcome, "outcome must not be null");
        provider = provider == null ? "" : provider;
        model = model == null ? "" : model;
        message = message == null ? "" : message;
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public boolean succeeded() {
        return outcome == ExtractionOutcome.SUCCESS || outcome == ExtractionOutcome.FALLBACK_SUCCESS;
    }

    public Optional<ExtractionResult> resultIfPresent() {
        return Optional.ofNullable(result);
    }

    /**
     * Outcome label as reported to metrics and callers, e.g. {@code error_rate_limit}.
     */
    public String outcomeCode() {
        return switch (outcome) {
            case SUCCESS -> "success";
            case FALLBACK_SUCCESS -> "fallback_success";
            case ERROR -> "error_" + (errorKind == null ? ErrorKind.UNKNOWN : errorKind).code();
            case CIRCUIT_OPEN -> "circuit_open";
            case BUDGET_BLOCKED -> "budget_blocked";
            case CANCELLED -> "cancelled";
        };
    }

    public ExtractionReport withResult(ExtractionResult merged) {
        return new ExtractionReport(requestId, outcome, errorKind, merged, provider, model, repairPass, message, attempts);
    }
}
