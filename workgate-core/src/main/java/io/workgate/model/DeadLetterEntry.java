package io.workgate.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal record of a unit of work that exhausted its retries.
 */
public record DeadLetterEntry(
        String id,
        String operationName,
        Map<String, String> arguments,
        String failureReason,
        FailureType failureType,
        int attemptsMade,
        Instant createdAt) {

    public DeadLetterEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(failureType, "failureType");
        Objects.requireNonNull(createdAt, "createdAt");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
}
