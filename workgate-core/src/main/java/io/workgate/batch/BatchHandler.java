package io.workgate.batch;

import java.util.List;

/**
 * Turns a group of buffered operations into one upstream batch call.
 *
 * <p>Implementations return exactly one outcome per input operation, in input order.
 * Throwing fails every operation of the flush.
 */
@FunctionalInterface
public interface BatchHandler {

    List<OperationOutcome> handle(String organizationId, List<BatchOperation> operations);
}
