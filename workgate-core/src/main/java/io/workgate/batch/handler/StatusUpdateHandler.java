package io.workgate.batch.handler;

import io.workgate.batch.BatchHandler;
import io.workgate.batch.BatchOperation;
import io.workgate.batch.OperationOutcome;
import io.workgate.spi.ControlPlaneClient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flushes workflow-execution status updates through
 * {@link ControlPlaneClient#batchUpdateExecutionStatus}.
 *
 * <p>Operations without an execution id or a {@code status} field are rejected locally
 * and never sent.
 */
public final class StatusUpdateHandler implements BatchHandler {
    private final ControlPlaneClient controlPlane;

    public StatusUpdateHandler(ControlPlaneClient controlPlane) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
    }

    @Override
    public List<OperationOutcome> handle(String organizationId, List<BatchOperation> operations) {
        OperationOutcome[] outcomes = new OperationOutcome[operations.size()];
        List<BatchOperation> valid = new ArrayList<>();
        List<Map<String, Object>> updates = new ArrayList<>();
        int[] positions = new int[operations.size()];
        for (int i = 0; i < operations.size(); i++) {
            BatchOperation op = operations.get(i);
            String executionId = op.executionId() != null ? op.executionId() : op.payloadString("execution_id");
            String status = op.payloadString("status");
            if (executionId == null || status == null) {
                outcomes[i] = OperationOutcome.failed(op.operationId(), "Missing execution_id or status");
                continue;
            }
            Map<String, Object> update = new LinkedHashMap<>(op.payload());
            update.put("execution_id", executionId);
            update.put("status", status);
            positions[valid.size()] = i;
            valid.add(op);
            updates.add(update);
        }
        if (!valid.isEmpty()) {
            List<OperationOutcome> remote = controlPlane.batchUpdateExecutionStatus(updates, organizationId);
            Outcomes.attach(valid, remote, outcomes, Arrays.copyOf(positions, valid.size()));
        }
        return Arrays.asList(outcomes);
    }
}
