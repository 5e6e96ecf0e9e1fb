package io.workgate.model;

/**
 * Execution status values shared with the control plane.
 */
public enum ExecutionStatus {
    PENDING,
    QUEUED,
    EXECUTING,
    COMPLETED,
    ERROR,
    STOPPED;

    /**
     * Parses a status name case-insensitively.
     *
     * @return the status, or {@code null} if {@code value} is null or unknown
     */
    public static ExecutionStatus parse(String value) {
        if (value == null) {
            return null;
        }
        for (ExecutionStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }

    /**
     * Whether an item whose history carries this status should be skipped when seen at
     * the same path again.
     */
    public boolean blocksReprocessing() {
        return this == PENDING || this == EXECUTING || this == COMPLETED;
    }
}
