package io.workgate.resilience;

/**
 * Same delay before every retry.
 */
public final class FixedBackoffRetryPolicy implements RetryPolicy {
    private final long delayMs;

    public FixedBackoffRetryPolicy(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
        this.delayMs = delayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        return attempts <= 0 ? 0L : delayMs;
    }
}
