package io.workgate;

import io.workgate.discovery.DiscoveryRequest;

import java.util.Objects;

/**
 * One coordinated execution of a workflow.
 *
 * @param workflowId     workflow to run
 * @param executionId    id of this execution
 * @param organizationId tenant
 * @param taskName       task-queue task that processes one item
 * @param discovery      where and how much to discover
 * @param useHistory     skip items already processed according to the control plane
 */
public record ExecutionRequest(
        String workflowId,
        String executionId,
        String organizationId,
        String taskName,
        DiscoveryRequest discovery,
        boolean useHistory) {

    public ExecutionRequest {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(discovery, "discovery");
    }
}
