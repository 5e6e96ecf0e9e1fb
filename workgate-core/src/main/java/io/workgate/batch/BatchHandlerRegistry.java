package io.workgate.batch;

/**
 * Maps each {@link OperationType} to the {@link BatchHandler} that flushes it.
 *
 * @see DefaultBatchHandlerRegistry
 */
public interface BatchHandlerRegistry {

    /**
     * @return the handler, or {@code null} if none is registered
     */
    BatchHandler handlerFor(OperationType type);
}
