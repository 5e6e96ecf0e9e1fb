package io.workgate.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A lease held by one execution on one item.
 */
public record ActiveClaim(
        String workflowId,
        ItemKey itemKey,
        String executionId,
        Instant claimedAt,
        Duration ttl) {

    public ActiveClaim {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(itemKey, "itemKey");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(claimedAt, "claimedAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    public boolean isHeldBy(String otherExecutionId) {
        return executionId.equals(otherExecutionId);
    }
}
