package io.workgate.filter;

import io.workgate.lock.ActiveCheck;
import io.workgate.lock.ActiveItemLockManager;
import io.workgate.model.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drops items that a different execution is processing right now.
 *
 * <p>Read-only: leases are written later by {@link ActiveItemLockManager#claim}. Any
 * failure lets items through.
 */
public final class ActiveItemFilter implements ItemFilter {
    private static final Logger logger = Logger.getLogger(ActiveItemFilter.class.getName());

    private final ActiveItemLockManager lockManager;

    public ActiveItemFilter(ActiveItemLockManager lockManager) {
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
    }

    @Override
    public String name() {
        return "active-item";
    }

    @Override
    public List<WorkItem> apply(List<WorkItem> items, FilterContext context) {
        ActiveCheck check;
        try {
            check = lockManager.checkActive(items, context.workflowId(), context.executionId());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Active-item check failed, letting " + items.size() + " items through", e);
            return items;
        }
        if (check.activeKeys().isEmpty()) {
            return items;
        }
        List<WorkItem> survivors = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            if (!check.isActive(item.key())) {
                survivors.add(item);
            }
        }
        return survivors;
    }
}
