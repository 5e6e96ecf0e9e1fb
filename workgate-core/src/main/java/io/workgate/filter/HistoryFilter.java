package io.workgate.filter;

import io.workgate.model.HistoryRecord;
import io.workgate.model.ItemKey;
import io.workgate.model.WorkItem;
import io.workgate.spi.ControlPlaneClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Skips items the control plane has already processed at the same path.
 *
 * <p>An item is skipped when its history record is found and either
 * <ul>
 *   <li>the execution limit is exceeded ({@code hasExceededLimit}, or when that is absent,
 *       {@code executionCount >= maxExecutionCount}), or</li>
 *   <li>its status is PENDING, EXECUTING or COMPLETED and the recorded path equals the
 *       current path.</li>
 * </ul>
 * Content reused at a different path is new work.
 *
 * <p>Each call makes at most one batched history request. Items without a provider
 * identity are never looked up. The execution limit applies even when the status is
 * unknown; otherwise a missing or malformed record lets its item through,
 * and a failed request lets the whole batch through: the cost is reprocessing, never a
 * lost item. Verdicts are memoised for the lifetime of the instance.
 */
public final class HistoryFilter implements ItemFilter {
    private static final Logger logger = Logger.getLogger(HistoryFilter.class.getName());

    private final ControlPlaneClient controlPlane;
    private final Map<String, Boolean> skipVerdicts = new HashMap<>();

    public HistoryFilter(ControlPlaneClient controlPlane) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
    }

    @Override
    public String name() {
        return "history";
    }

    @Override
    public synchronized List<WorkItem> apply(List<WorkItem> items, FilterContext context) {
        List<ItemKey> toLookup = new ArrayList<>();
        for (WorkItem item : items) {
            ItemKey key = item.key();
            if (key.hasProviderIdentity() && !skipVerdicts.containsKey(memoKey(context, key))) {
                toLookup.add(key);
            }
        }
        if (!toLookup.isEmpty()) {
            lookup(toLookup, context);
        }
        List<WorkItem> survivors = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            ItemKey key = item.key();
            if (!key.hasProviderIdentity()
                    || !Boolean.TRUE.equals(skipVerdicts.get(memoKey(context, key)))) {
                survivors.add(item);
            }
        }
        return survivors;
    }

    private void lookup(List<ItemKey> keys, FilterContext context) {
        Map<String, HistoryRecord> records;
        try {
            records = controlPlane.checkHistoryBatch(context.workflowId(), keys, context.organizationId());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "History lookup failed for " + keys.size()
                    + " items, processing them without history", e);
            return;
        }
        if (records == null) {
            return;
        }
        for (ItemKey key : keys) {
            HistoryRecord record = records.get(key.composite());
            skipVerdicts.put(memoKey(context, key), shouldSkip(key, record));
        }
    }

    static boolean shouldSkip(ItemKey key, HistoryRecord record) {
        if (record == null || !record.found()) {
            return false;
        }
        if (record.exceededExecutionLimit()) {
            logger.log(Level.FINE, "Skipping {0}: execution limit reached ({1}/{2})",
                    new Object[]{key.composite(), record.executionCount(), record.maxExecutionCount()});
            return true;
        }
        if (!record.isWellFormed()) {
            logger.log(Level.FINE, "Malformed history for {0}, reprocessing", key.composite());
            return false;
        }
        return record.status().blocksReprocessing() && key.path().equals(record.pathAtCompletion());
    }

    private static String memoKey(FilterContext context, ItemKey key) {
        return context.workflowId() + ":" + key.composite();
    }
}
