package io.mnemo.core.retry;

import java.util.Locale;

/**
 * Canonical classification of a failed provider attempt.
 */
public enum ErrorKind {
    RATE_LIMIT,
    TIMEOUT,
    AUTHENTICATION,
    INVALID_REQUEST,
    PARSING,
    BUDGET_EXCEEDED,
    POLICY,
    TRANSIENT,
    UNKNOWN;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kinds caused by the transport or provider load. They share one attempt cap per provider.
     */
    public boolean transport() {
        return this == RATE_LIMIT || this == TIMEOUT || this == TRANSIENT;
    }

    /**
     * Whether an attempt failing with this kind counts against the provider's circuit. Kinds where
     * the provider answered properly (auth, bad request, policy, quota, unparseable text) do not.
     */
    public boolean circuitFailure() {
        return transport() || this == UNKNOWN;
    }

    public static ErrorKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
