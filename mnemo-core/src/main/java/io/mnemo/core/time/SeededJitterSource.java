package io.mnemo.core.time;

import java.util.Random;

public final class SeededJitterSource implements JitterSource {
    private final Random random;

    public SeededJitterSource(long seed) {
        this.random = new Random(seed);
    }

    public SeededJitterSource() {
        this.random = new Random();
    }

    @Override
    public synchronized long nextJitterMillis(long boundMillis) {
        if (boundMillis <= 0) {
            return 0L;
        }
        return Math.round((random.nextDouble() * 2.0 - 1.0) * boundMillis);
    }
}
