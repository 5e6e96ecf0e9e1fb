package io.workgate.execution;

import io.workgate.model.DeadLetterEntry;

/**
 * Terminal result of one unit submitted through the {@link TaskExecutionEngine}.
 */
public sealed interface TaskOutcome {

    RetryableUnit unit();

    default boolean succeeded() {
        return this instanceof Succeeded;
    }

    /**
     * The remote task completed successfully.
     */
    record Succeeded(RetryableUnit unit, String trackingId) implements TaskOutcome {
    }

    /**
     * Retries are exhausted or not allowed; the unit was written to the dead-letter store.
     */
    record DeadLettered(RetryableUnit unit, DeadLetterEntry entry) implements TaskOutcome {
    }

    /**
     * Retries are exhausted or not allowed, but the dead-letter store rejected the entry,
     * so it cannot be replayed by id.
     *
     * @param storeError message of the store failure
     */
    record DeadLetterFailed(RetryableUnit unit, DeadLetterEntry entry, String storeError) implements TaskOutcome {
    }

    /**
     * The unit was cancelled between attempts or the engine shut down.
     */
    record Cancelled(RetryableUnit unit) implements TaskOutcome {
    }
}
