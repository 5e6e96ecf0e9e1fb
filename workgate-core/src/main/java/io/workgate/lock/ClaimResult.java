package io.workgate.lock;

import io.workgate.model.WorkItem;

import java.util.List;

/**
 * Result of {@link ActiveItemLockManager#claim}.
 *
 * @param claimedItems items for which a lease was written
 * @param unleased     items whose lease write failed; they may still be processed
 * @param stats        counters for the claim call
 */
public record ClaimResult(List<WorkItem> claimedItems, List<WorkItem> unleased, ClaimStats stats) {

    public ClaimResult {
        claimedItems = List.copyOf(claimedItems);
        unleased = List.copyOf(unleased);
    }

    /**
     * @param requested distinct items asked to be claimed
     * @param created   leases written
     * @param errors    lease writes that failed
     */
    public record ClaimStats(int requested, int created, int errors) {
    }
}
