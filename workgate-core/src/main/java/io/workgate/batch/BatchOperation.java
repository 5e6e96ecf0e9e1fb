package io.workgate.batch;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One buffered write request.
 *
 * @param operationType  kind of write
 * @param operationId    caller-chosen id, reported back in the {@link OperationOutcome}
 * @param payload        fields of the write
 * @param organizationId tenant the write belongs to
 * @param executionId    execution the write concerns, may be {@code null}
 * @param createdAt      enqueue time
 * @param callback       completion callback
 */
public record BatchOperation(
        OperationType operationType,
        String operationId,
        Map<String, Object> payload,
        String organizationId,
        String executionId,
        Instant createdAt,
        CompletionCallback callback) {

    public BatchOperation {
        Objects.requireNonNull(operationType, "operationType");
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = payload == null ? Map.of() : payload;
        callback = callback == null ? CompletionCallback.NONE : callback;
    }

    /**
     * Returns the payload value for {@code key} as a string, or {@code null}.
     */
    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }
}
