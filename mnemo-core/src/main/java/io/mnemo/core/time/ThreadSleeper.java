package io.mnemo.core.time;

import java.time.Duration;

public final class ThreadSleeper implements Sleeper {
    private static final long SLICE_MS = 50;

    @Override
    public boolean sleep(Duration duration, CancellationToken token) {
        long remaining = Math.max(0, duration.toMillis());
        while (remaining > 0) {
            if (token.isCancelled()) {
                return false;
            }
            long slice = Math.min(SLICE_MS, remaining);
            try {
                Thread.sleep(slice);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                token.cancel();
                return false;
            }
            remaining -= slice;
        }
        return !token.isCancelled();
    }
}
