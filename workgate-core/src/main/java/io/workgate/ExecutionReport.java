package io.workgate;

import io.workgate.discovery.DiscoveryStats;

/**
 * Summary of a finished {@link WorkGate#run} call.
 *
 * @param workflowId   workflow that ran
 * @param executionId  execution id
 * @param discovery    discovery counters
 * @param selected     items in the final bounded batch
 * @param claimed      leases written for the batch
 * @param succeeded    items whose task succeeded
 * @param deadLettered items that ended in the dead-letter store
 * @param unrecorded   items that exhausted their attempts but whose dead letter could not be stored
 * @param cancelled    items cancelled before completion
 */
public record ExecutionReport(
        String workflowId,
        String executionId,
        DiscoveryStats discovery,
        int selected,
        int claimed,
        int succeeded,
        int deadLettered,
        int unrecorded,
        int cancelled) {

    public boolean allFilteredOut() {
        return selected == 0 && discovery.itemsMatched() > 0;
    }
}
