package io.workgate.resilience;

/**
 * Linear backoff: {@code step * attempt}, capped at {@code maxDelay}.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
    private final long stepMs;
    private final long maxDelayMs;

    public LinearBackoffRetryPolicy(long stepMs, long maxDelayMs) {
        if (stepMs < 0) {
            throw new IllegalArgumentException("stepMs must be >= 0, got: " + stepMs);
        }
        if (maxDelayMs < 0) {
            throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
        }
        this.stepMs = stepMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0 || stepMs == 0) {
            return 0L;
        }
        if (attempts > maxDelayMs / stepMs) {
            return maxDelayMs;
        }
        return stepMs * attempts;
    }
}
