package io.mnemo.core.provider;

import io.mnemo.core.retry.ErrorKind;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;

/**
 * Maps HTTP statuses, provider error types and I/O failures onto {@link ErrorKind}.
 */
public final class HttpErrorClassifier {
    private static final int MAX_BODY_IN_MESSAGE = 300;

    private HttpErrorClassifier() {
    }

    public static ErrorKind classifyStatus(int status, String body) {
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        if (status == 429) {
            return lower.contains("insufficient_quota") ? ErrorKind.BUDGET_EXCEEDED : ErrorKind.RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return ErrorKind.AUTHENTICATION;
        }
        if (status == 402) {
            return ErrorKind.BUDGET_EXCEEDED;
        }
        if (status == 408 || status == 504) {
            return ErrorKind.TIMEOUT;
        }
        if (status == 400 || status == 404 || status == 413 || status == 422) {
            if (lower.contains("content_policy") || lower.contains("content policy") || lower.contains("safety")) {
                return ErrorKind.POLICY;
            }
            return ErrorKind.INVALID_REQUEST;
        }
        if (status >= 500 && status <= 599) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.UNKNOWN;
    }

    public static ProviderException fromStatus(String provider, int status, String body, String retryAfterHeader) {
        ErrorKind kind = classifyStatus(status, body);
        String message = "Provider " + provider + " returned HTTP " + status + ": " + truncate(body);
        return new ProviderException(kind, message, status, parseRetryAfter(retryAfterHeader), false, null);
    }

    public static ProviderException fromIOException(String provider, IOException error) {
        ErrorKind kind = error instanceof SocketTimeoutException || error instanceof InterruptedIOException
            ? ErrorKind.TIMEOUT
            : ErrorKind.TRANSIENT;
        return new ProviderException(kind, "Provider " + provider + " call failed: " + error.getMessage(), error);
    }

    /**
     * Classifies the {@code error.type} carried by an in-stream error event.
     */
    public static ErrorKind classifyErrorType(String type) {
        String value = type == null ? "" : type.toLowerCase(Locale.ROOT);
        switch (value) {
            case "rate_limit_error":
            case "rate_limit_exceeded":
                return ErrorKind.RATE_LIMIT;
            case "overloaded_error":
            case "api_error":
            case "server_error":
                return ErrorKind.TRANSIENT;
            case "authentication_error":
            case "permission_error":
                return ErrorKind.AUTHENTICATION;
            case "invalid_request_error":
            case "not_found_error":
            case "request_too_large":
                return ErrorKind.INVALID_REQUEST;
            case "insufficient_quota":
                return ErrorKind.BUDGET_EXCEEDED;
            case "timeout_error":
                return ErrorKind.TIMEOUT;
            default:
                return ErrorKind.UNKNOWN;
        }
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= MAX_BODY_IN_MESSAGE) {
            return value;
        }
        return value.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
