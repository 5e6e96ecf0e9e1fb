package io.workgate.batch;

/**
 * Result of one operation within a batched call.
 *
 * @param operationId id of the operation, {@code null} when the remote side only
 *                    reports positional results
 * @param success     whether the operation was applied
 * @param error       error message when {@code success} is false
 */
public record OperationOutcome(String operationId, boolean success, String error) {

    public static OperationOutcome ok(String operationId) {
        return new OperationOutcome(operationId, true, null);
    }

    public static OperationOutcome failed(String operationId, String error) {
        return new OperationOutcome(operationId, false, error);
    }

    public OperationOutcome withOperationId(String id) {
        return new OperationOutcome(id, success, error);
    }
}
