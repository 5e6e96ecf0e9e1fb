package io.workgate.filter;

import io.workgate.lock.ActiveItemLockManager;
import io.workgate.model.WorkItem;
import io.workgate.spi.ControlPlaneClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered chain of {@link ItemFilter}s applied to one micro-batch at a time.
 *
 * <p>Stops as soon as a filter leaves nothing. A filter that throws despite its contract
 * is logged and skipped, so the pipeline itself never fails a run.
 */
public final class FilterPipeline {
    private static final Logger logger = Logger.getLogger(FilterPipeline.class.getName());

    private final List<ItemFilter> filters;

    public FilterPipeline(List<ItemFilter> filters) {
        Objects.requireNonNull(filters, "filters");
        for (ItemFilter filter : filters) {
            Objects.requireNonNull(filter, "filters must not contain null");
        }
        this.filters = List.copyOf(filters);
    }

    /**
     * The standard order, cheapest first: deduplication, history, active-item.
     *
     * @param controlPlane       used by the history filter
     * @param lockManager        used by the active-item filter
     * @param useHistory         include the history filter
     * @param enableActiveFilter include the active-item filter
     */
    public static FilterPipeline standard(ControlPlaneClient controlPlane, ActiveItemLockManager lockManager,
            boolean useHistory, boolean enableActiveFilter) {
        List<ItemFilter> filters = new ArrayList<>(3);
        filters.add(new DeduplicationFilter());
        if (useHistory) {
            filters.add(new HistoryFilter(controlPlane));
        }
        if (enableActiveFilter) {
            filters.add(new ActiveItemFilter(lockManager));
        }
        return new FilterPipeline(filters);
    }

    public List<ItemFilter> filters() {
        return filters;
    }

    public List<WorkItem> apply(List<WorkItem> items, FilterContext context) {
        List<WorkItem> current = items;
        for (ItemFilter filter : filters) {
            if (current.isEmpty()) {
                break;
            }
            int before = current.size();
            try {
                current = List.copyOf(filter.apply(current, context));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Filter " + filter.name() + " failed, passing "
                        + before + " items through unfiltered", e);
                continue;
            }
            if (current.size() != before) {
                logger.log(Level.FINE, "Filter {0}: {1} -> {2} items",
                        new Object[]{filter.name(), before, current.size()});
            }
        }
        return current;
    }
}
