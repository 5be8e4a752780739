package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * One provider call attempt. {@code errorKind} is empty for successful attempts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttemptRecord(
    String requestId,
    String provider,
    String model,
    Instant timestamp,
    long latencyMs,
    String outcome,
    String errorKind,
    int inputTokens,
    int outputTokens,
    double costUsd,
    boolean fallback,
    boolean corrective
) {
    public AttemptRecord {
        requestId = requestId == null ? "" : requestId;
        provider = provider == null ? "" : provider;
        model = model == null ? "" : model;
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        latencyMs = Math.max(0, latencyMs);
        outcome = outcome == null ? "" : outcome;
        errorKind = errorKind == null ? "" : errorKind;
        costUsd = Math.max(0.0, costUsd);
    }

    public boolean succeeded() {
        return errorKind.isBlank() && "success".equals(outcome);
    }
}
