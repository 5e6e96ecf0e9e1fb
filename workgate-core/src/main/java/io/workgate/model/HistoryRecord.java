package io.workgate.model;

/**
 * Durable processing history for one item, owned by the control plane.
 *
 * @param key                the item the record was requested for
 * @param found              whether any history exists
 * @param status             last recorded status, {@code null} when unknown
 * @param pathAtCompletion   path recorded with the last execution
 * @param executionCount     number of executions recorded so far
 * @param maxExecutionCount  configured cutoff for re-executions
 * @param hasExceededLimit   server-side verdict on the cutoff, {@code null} if not supplied
 */
public record HistoryRecord(
        ItemKey key,
        boolean found,
        ExecutionStatus status,
        String pathAtCompletion,
        int executionCount,
        int maxExecutionCount,
        Boolean hasExceededLimit) {

    public static final int DEFAULT_MAX_EXECUTION_COUNT = 3;

    public static HistoryRecord notFound(ItemKey key) {
        return new HistoryRecord(key, false, null, null, 0, DEFAULT_MAX_EXECUTION_COUNT, null);
    }

    /**
     * A found record must carry a status and non-negative counters to take part in a
     * skip decision.
     */
    public boolean isWellFormed() {
        if (!found) {
            return true;
        }
        return status != null && executionCount >= 0 && maxExecutionCount > 0;
    }

    /**
     * The server-side verdict when supplied, otherwise the counters. Needs no status.
     */
    public boolean exceededExecutionLimit() {
        if (hasExceededLimit != null) {
            return hasExceededLimit;
        }
        return maxExecutionCount > 0 && executionCount >= maxExecutionCount;
    }
}
