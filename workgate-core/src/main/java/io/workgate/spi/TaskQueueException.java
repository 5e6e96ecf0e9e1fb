package io.workgate.spi;

/**
 * Thrown when the task queue broker cannot accept or answer a request.
 */
public class TaskQueueException extends RuntimeException {

    public TaskQueueException(String message) {
        super(message);
    }

    public TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
