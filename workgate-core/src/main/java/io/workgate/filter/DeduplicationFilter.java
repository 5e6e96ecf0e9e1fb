package io.workgate.filter;

import io.workgate.model.ItemKey;
import io.workgate.model.WorkItem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the first occurrence of each {@link ItemKey}, no I/O.
 *
 * <p>State lives as long as the filter instance, normally one discovery pass. The
 * occurrence that won (identified by its discovery sequence) keeps winning when
 * presented again, so re-applying the filter to the same items is repeatable.
 */
public final class DeduplicationFilter implements ItemFilter {
    private final Map<ItemKey, Long> firstOccurrence = new HashMap<>();

    @Override
    public String name() {
        return "deduplication";
    }

    @Override
    public synchronized List<WorkItem> apply(List<WorkItem> items, FilterContext context) {
        List<WorkItem> unique = new ArrayList<>(items.size());
        Set<ItemKey> emitted = new HashSet<>();
        for (WorkItem item : items) {
            ItemKey key = item.key();
            Long winner = firstOccurrence.putIfAbsent(key, item.discoverySequence());
            boolean wins = winner == null || winner == item.discoverySequence();
            if (wins && emitted.add(key)) {
                unique.add(item);
            }
        }
        return unique;
    }
}
