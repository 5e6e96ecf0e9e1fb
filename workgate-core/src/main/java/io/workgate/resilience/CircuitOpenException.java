package io.workgate.resilience;

import java.time.Instant;

/**
 * Thrown when a call is rejected because its circuit is open.
 */
public class CircuitOpenException extends RuntimeException {
    private final String operationName;
    private final Instant retryAt;

    public CircuitOpenException(String operationName, Instant retryAt) {
        super("Circuit '" + operationName + "' is open until " + retryAt);
        this.operationName = operationName;
        this.retryAt = retryAt;
    }

    public String operationName() {
        return operationName;
    }

    /**
     * Earliest instant at which a probe call will be let through.
     */
    public Instant retryAt() {
        return retryAt;
    }
}
