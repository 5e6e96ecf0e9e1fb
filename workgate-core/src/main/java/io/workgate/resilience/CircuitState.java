package io.workgate.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /** Calls pass through; failures are counted. */
    CLOSED,
    /** Calls are rejected without reaching the remote side. */
    OPEN,
    /** Cool-down elapsed; a single probe call is let through. */
    HALF_OPEN
}
