package io.workgate.spi;

import io.workgate.batch.OperationOutcome;
import io.workgate.model.HistoryRecord;
import io.workgate.model.ItemKey;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upstream control-plane API used for history lookups, active-execution lookups and
 * batched status writes.
 *
 * <p>All methods throw {@link ControlPlaneException} on remote failure. Batched writes
 * return one {@link OperationOutcome} per submitted update, in submission order, so a
 * partial failure never collapses into a single result.
 */
public interface ControlPlaneClient {

    /**
     * Looks up processing history for a batch of items in one call.
     *
     * @return records keyed by {@link ItemKey#composite()}; items without history may be
     *     omitted or returned with {@code found=false}
     */
    Map<String, HistoryRecord> checkHistoryBatch(String workflowId, List<ItemKey> items,
            String organizationId);

    /**
     * Finds items that an execution other than {@code currentExecutionId} is processing
     * according to the durable execution records.
     *
     * @return composite keys of the active items among {@code items}
     */
    Set<String> checkActiveProcessing(String workflowId, List<ItemKey> items,
            String currentExecutionId);

    List<OperationOutcome> batchUpdateExecutionStatus(List<Map<String, Object>> updates,
            String organizationId);

    List<OperationOutcome> batchUpdatePipelineStatus(List<Map<String, Object>> updates,
            String organizationId);

    List<OperationOutcome> batchUpdateFileExecutionStatus(String executionId,
            List<Map<String, Object>> updates, String organizationId);
}
