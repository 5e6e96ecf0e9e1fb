package io.workgate.execution;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of work submitted through the {@link TaskExecutionEngine}.
 *
 * @param unitId                 stable id, used for cancellation
 * @param operationName          task name on the queue
 * @param arguments              task arguments
 * @param attemptCount           attempts made so far
 * @param lastError              error of the last failed attempt, {@code null} if none
 * @param failureClassification  classification of the last failure, {@code null} if none
 */
public record RetryableUnit(
        String unitId,
        String operationName,
        Map<String, String> arguments,
        int attemptCount,
        String lastError,
        FailureClassification failureClassification) {

    public RetryableUnit {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(operationName, "operationName");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static RetryableUnit of(String operationName, Map<String, String> arguments) {
        return new RetryableUnit(UUID.randomUUID().toString(), operationName, arguments, 0, null, null);
    }

    RetryableUnit failedAttempt(String error, FailureClassification classification) {
        return new RetryableUnit(unitId, operationName, arguments, attemptCount + 1, error, classification);
    }

    RetryableUnit succeededAttempt() {
        return new RetryableUnit(unitId, operationName, arguments, attemptCount + 1, lastError,
                failureClassification);
    }
}
