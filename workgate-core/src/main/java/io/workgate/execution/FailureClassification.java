package io.workgate.execution;

/**
 * How a failed attempt is classified. The classification decides whether the unit is
 * retried.
 */
public enum FailureClassification {
    /** The task was never confirmed: broker or network trouble. Retried. */
    TRANSIENT_LOST,
    /** The task ran and reported an error. Not retried by default. */
    EXECUTED_AND_FAILED
}
