package io.workgate.batch.handler;

import io.workgate.batch.BatchHandler;
import io.workgate.batch.BatchOperation;
import io.workgate.batch.OperationOutcome;
import io.workgate.spi.ControlPlaneClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Flushes pipeline status updates through {@link ControlPlaneClient#batchUpdatePipelineStatus}.
 */
public final class PipelineUpdateHandler implements BatchHandler {
    private final ControlPlaneClient controlPlane;

    public PipelineUpdateHandler(ControlPlaneClient controlPlane) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
    }

    @Override
    public List<OperationOutcome> handle(String organizationId, List<BatchOperation> operations) {
        List<Map<String, Object>> updates = new ArrayList<>(operations.size());
        for (BatchOperation op : operations) {
            updates.add(op.payload());
        }
        List<OperationOutcome> remote = controlPlane.batchUpdatePipelineStatus(updates, organizationId);
        OperationOutcome[] outcomes = new OperationOutcome[operations.size()];
        Outcomes.attach(operations, remote, outcomes, IntStream.range(0, operations.size()).toArray());
        return List.of(outcomes);
    }
}
