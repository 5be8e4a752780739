package io.mnemo.core.time;

import java.time.Duration;

/**
 * Suspends the calling thread. Every wait in the extraction path goes through a sleeper so tests can
 * advance a fake clock instead of blocking.
 */
public interface Sleeper {

    /**
     * Waits for {@code duration} or until {@code token} is cancelled, whichever comes first.
     *
     * @return {@code false} if the wait ended because of cancellation
     */
    boolean sleep(Duration duration, CancellationToken token);
}
