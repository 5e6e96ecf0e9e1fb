package io.workgate.batch;

import java.util.Map;

/**
 * Snapshot of aggregator activity.
 *
 * @param pendingByGroup     buffered operations per {@code TYPE:organization} group
 * @param flushes            batch calls made
 * @param operationsFlushed  operations handed to a handler
 * @param operationsFailed   operations whose outcome was a failure
 * @param running            whether the background flusher is active
 */
public record BatchStats(
        Map<String, Integer> pendingByGroup,
        long flushes,
        long operationsFlushed,
        long operationsFailed,
        boolean running) {

    public int totalPending() {
        return pendingByGroup.values().stream().mapToInt(Integer::intValue).sum();
    }
}
