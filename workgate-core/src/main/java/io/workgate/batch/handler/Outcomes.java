package io.workgate.batch.handler;

import io.workgate.batch.BatchOperation;
import io.workgate.batch.OperationOutcome;

import java.util.List;

final class Outcomes {

    private Outcomes() {
    }

    /**
     * Pairs positional upstream results with the operations that produced them. Missing
     * results count as failures so a short response never reads as success.
     */
    static void attach(List<BatchOperation> sent, List<OperationOutcome> remote,
            OperationOutcome[] target, int[] positions) {
        for (int i = 0; i < sent.size(); i++) {
            BatchOperation op = sent.get(i);
            OperationOutcome outcome = remote != null && i < remote.size() && remote.get(i) != null
                    ? remote.get(i).withOperationId(op.operationId())
                    : OperationOutcome.failed(op.operationId(), "No result returned for update");
            target[positions[i]] = outcome;
        }
    }

    static void failAll(List<BatchOperation> sent, String error, OperationOutcome[] target,
            int[] positions) {
        for (int i = 0; i < sent.size(); i++) {
            target[positions[i]] = OperationOutcome.failed(sent.get(i).operationId(), error);
        }
    }
}
