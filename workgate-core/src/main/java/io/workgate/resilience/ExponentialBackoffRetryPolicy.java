package io.workgate.resilience;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 * With jitter enabled the delay is scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, true);
    }

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long delay = maxDelayMs;
        if (attempts < 63) {
            long factor = 1L << (attempts - 1);
            // factor * base would overflow past the cap
            if (factor <= maxDelayMs / baseDelayMs) {
                delay = baseDelayMs * factor;
            }
        }
        if (jitter) {
            delay = (long) (delay * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
        }
        return Math.max(0L, Math.min(maxDelayMs, delay));
    }
}
