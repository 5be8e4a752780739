package io.mnemo.core.time;

/**
 * Source of backoff jitter. Injected so that retry delays are reproducible in tests.
 */
public interface JitterSource {

    /**
     * Returns a jitter value in {@code [-boundMillis, boundMillis]}.
     */
    long nextJitterMillis(long boundMillis);

    static JitterSource none() {
        return boundMillis -> 0L;
    }
}
