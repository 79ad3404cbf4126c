package io.bundlemesh.propagation;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential retry delay: {@code base * 2^(attempts-1)}, capped at {@code max},
 * with optional jitter in [0.5, 1.5).
 */
public final class BackoffPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, true);
    }

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
        if (baseDelayMs <= 0L || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("backoff requires 0 < base <= max");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempts >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long factor = 1L << (attempts - 1);
            expDelay = baseDelayMs > Long.MAX_VALUE / factor ? Long.MAX_VALUE : baseDelayMs * factor;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        if (!jitter) {
            return capped;
        }
        double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        long withJitter = (long) (capped * factor);
        return Math.min(maxDelayMs, Math.max(0L, withJitter));
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}
