package io.mnemo.core.retry;

import java.time.Duration;

/**
 * @param callTimeout deadline of a single provider call
 * @param admissionTimeout longest wait for rate limiter admission per attempt
 * @param streaming use the provider's streaming API when it supports one
 */
public record OrchestratorSettings(Duration callTimeout, Duration admissionTimeout, boolean streaming, double temperature) {
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_ADMISSION_TIMEOUT = Duration.ofSeconds(30);

    public OrchestratorSettings {
        callTimeout = callTimeout == null || callTimeout.isZero() || callTimeout.isNegative() ? DEFAULT_CALL_TIMEOUT : callTimeout;
        admissionTimeout = admissionTimeout == null || admissionTimeout.isNegative() ? DEFAULT_ADMISSION_TIMEOUT : admissionTimeout;
        temperature = Double.isNaN(temperature) ? 0.2 : temperature;
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(DEFAULT_CALL_TIMEOUT, DEFAULT_ADMISSION_TIMEOUT, false, 0.2);
    }
}
