package io.mnemo.core.provider;

import io.mnemo.core.retry.ErrorKind;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A classified provider failure. Thrown by every {@link ProviderClient} operation and by local
 * gates that behave like provider errors (rate-limiter admission timeout).
 */
public class ProviderException extends RuntimeException {
    private final ErrorKind kind;
    private final Integer httpStatus;
    private final Duration retryAfter;
    private final boolean local;

    public ProviderException(ErrorKind kind, String message) {
        this(kind, message, null, null, false, null);
    }

    public ProviderException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, false, cause);
    }

    public ProviderException(
        ErrorKind kind,
        String message,
        Integer httpStatus,
        Duration retryAfter,
        boolean local,
        Throwable cause
    ) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.httpStatus = httpStatus;
        this.retryAfter = retryAfter;
        this.local = local;
    }

    public static ProviderException localRateLimit(String message) {
        return new ProviderException(ErrorKind.RATE_LIMIT, message, null, null, true, null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Optional<Integer> httpStatus() {
        return Optional.ofNullable(httpStatus);
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * True when the failure was produced in-process rather than reported by the provider.
     */
    public boolean local() {
        return local;
    }
}
