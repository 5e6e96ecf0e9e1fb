package io.workgate.spi;

import java.util.Map;

/**
 * Distributed task queue that runs named tasks on remote workers.
 *
 * <p>Both methods throw {@link TaskQueueException} when the broker cannot be reached.
 */
public interface TaskQueue {

    /**
     * Submits a named task.
     *
     * @return opaque tracking id
     */
    String submit(String taskName, Map<String, String> arguments);

    /**
     * Queries the state of a previously submitted task.
     */
    TaskStatus status(String trackingId);

    enum TaskState {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    /**
     * @param state state reported by the broker
     * @param error error reported by the task when {@code state} is FAILED
     */
    record TaskStatus(TaskState state, String error) {

        public static TaskStatus of(TaskState state) {
            return new TaskStatus(state, null);
        }

        public static TaskStatus failed(String error) {
            return new TaskStatus(TaskState.FAILED, error);
        }
    }
}
