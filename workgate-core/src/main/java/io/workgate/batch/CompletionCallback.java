package io.workgate.batch;

/**
 * Invoked once per buffered operation after the batch containing it was flushed.
 */
@FunctionalInterface
public interface CompletionCallback {

    CompletionCallback NONE = (operation, outcome) -> { };

    void onComplete(BatchOperation operation, OperationOutcome outcome);
}
