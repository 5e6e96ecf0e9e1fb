package io.workgate.discovery;

import io.workgate.model.WorkItem;

import java.util.List;

/**
 * Survivors of a discovery pass, in discovery order, never more than the hard limit.
 *
 * @param items survivors
 * @param stats pass counters
 * @param error fatal error that cut the walk short, {@code null} if it completed
 */
public record DiscoveryResult(List<WorkItem> items, DiscoveryStats stats, Throwable error) {

    public DiscoveryResult {
        items = List.copyOf(items);
    }

    public int count() {
        return items.size();
    }

    /**
     * Whether items matched the name pattern but every one of them was filtered out.
     */
    public boolean allFilteredOut() {
        return items.isEmpty() && stats.itemsMatched() > 0;
    }
}
