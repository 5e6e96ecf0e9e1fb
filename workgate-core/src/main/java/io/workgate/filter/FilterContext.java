package io.workgate.filter;

import java.util.Objects;

/**
 * Identifies the execution a filter pass runs for.
 *
 * @param workflowId     workflow whose items are filtered
 * @param executionId    current execution; leases held by it are not "active elsewhere"
 * @param organizationId tenant, forwarded to control-plane lookups
 */
public record FilterContext(String workflowId, String executionId, String organizationId) {

    public FilterContext {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(organizationId, "organizationId");
    }
}
