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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Flushes per-file status updates, one upstream call per execution.
 *
 * <p>A failing call fails only the operations of that execution.
 */
public final class FileStatusUpdateHandler implements BatchHandler {
    private static final Logger logger = Logger.getLogger(FileStatusUpdateHandler.class.getName());

    private final ControlPlaneClient controlPlane;

    public FileStatusUpdateHandler(ControlPlaneClient controlPlane) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
    }

    @Override
    public List<OperationOutcome> handle(String organizationId, List<BatchOperation> operations) {
        OperationOutcome[] outcomes = new OperationOutcome[operations.size()];
        Map<String, List<Integer>> byExecution = new LinkedHashMap<>();
        for (int i = 0; i < operations.size(); i++) {
            BatchOperation op = operations.get(i);
            String executionId = op.executionId() != null ? op.executionId() : op.payloadString("execution_id");
            if (executionId == null) {
                outcomes[i] = OperationOutcome.failed(op.operationId(), "Missing execution_id");
                continue;
            }
            byExecution.computeIfAbsent(executionId, k -> new ArrayList<>()).add(i);
        }
        for (Map.Entry<String, List<Integer>> group : byExecution.entrySet()) {
            List<BatchOperation> sent = new ArrayList<>();
            List<Map<String, Object>> updates = new ArrayList<>();
            int[] positions = group.getValue().stream().mapToInt(Integer::intValue).toArray();
            for (int position : positions) {
                sent.add(operations.get(position));
                updates.add(operations.get(position).payload());
            }
            try {
                List<OperationOutcome> remote = controlPlane.batchUpdateFileExecutionStatus(
                        group.getKey(), updates, organizationId);
                Outcomes.attach(sent, remote, outcomes, positions);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "File status update failed for execution " + group.getKey(), e);
                Outcomes.failAll(sent, String.valueOf(e.getMessage()), outcomes, positions);
            }
        }
        return Arrays.asList(outcomes);
    }
}
