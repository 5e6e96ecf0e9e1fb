package io.workgate.model;

/**
 * Why a unit of work ended up in the dead-letter store.
 */
public enum FailureType {
    /** Never confirmed within the poll budget on every attempt. */
    TIMEOUT("timeout"),
    /** The task ran and reported an error. */
    EXECUTION_ERROR("execution_error"),
    /** The task queue could not be reached to submit the task. */
    COMMUNICATION_ERROR("communication_error"),
    /** The circuit breaker kept rejecting the call. */
    CIRCUIT_OPEN("circuit_open");

    private final String code;

    FailureType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static FailureType fromCode(String code) {
        for (FailureType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown failure type: " + code);
    }
}
