package io.workgate.resilience;

/**
 * Computes the delay before the next attempt of a failed call.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see LinearBackoffRetryPolicy
 * @see FixedBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * @param attempts attempts made so far (1-based)
     * @return delay in milliseconds, never negative
     */
    long computeDelayMs(int attempts);
}
