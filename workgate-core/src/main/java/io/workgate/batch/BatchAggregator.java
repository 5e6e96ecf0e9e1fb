package io.workgate.batch;

import io.workgate.spi.MetricsExporter;
import io.workgate.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers small write requests and flushes them as few batched upstream calls.
 *
 * <p>Operations are grouped by {@code (operationType, organizationId)} so tenants and
 * operation kinds never wait on each other. A group is flushed
 * <ul>
 *   <li>immediately by {@link #enqueue} once it holds {@code maxBatchSize} operations,</li>
 *   <li>by the background flusher once its oldest operation is older than {@code maxWaitTime},</li>
 *   <li>by {@link #flushAll()}, {@link #flushByType} or {@link #close()}.</li>
 * </ul>
 *
 * <p>The pending map is guarded by one mutex that is never held while a handler runs.
 * Flushes of different groups may run concurrently; flushes of the same group are
 * serialized. A handler exception fails every operation of that flush and is otherwise
 * contained.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class BatchAggregator implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(BatchAggregator.class.getName());

    private final BatchHandlerRegistry handlers;
    private final BatchConfig config;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final Object pendingLock = new Object();
    private final Map<GroupKey, List<BatchOperation>> pending = new HashMap<>();
    private final Map<GroupKey, ReentrantLock> groupLocks = new ConcurrentHashMap<>();

    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong operationsFlushed = new AtomicLong();
    private final AtomicLong operationsFailed = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> flushTask;
    private volatile boolean closed;

    private BatchAggregator(Builder builder) {
        this.handlers = Objects.requireNonNull(builder.handlers, "handlers");
        this.config = builder.config != null ? builder.config : BatchConfig.DEFAULT;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the background flusher if auto-flush is enabled. Repeated calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("BatchAggregator has been closed");
        }
        if (!config.autoFlush() || flushTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("workgate-batch-flush-"));
        long intervalMs = config.flushInterval().toMillis();
        flushTask = scheduler.scheduleWithFixedDelay(this::flushExpired, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
    }

    public boolean enqueue(OperationType type, String operationId, Map<String, Object> payload,
            String organizationId) {
        return enqueue(type, operationId, payload, organizationId, null, null);
    }

    /**
     * Buffers one operation.
     *
     * @return {@code false} if the aggregator is closed and the operation was not accepted
     */
    public boolean enqueue(OperationType type, String operationId, Map<String, Object> payload,
            String organizationId, String executionId, CompletionCallback callback) {
        BatchOperation op = new BatchOperation(type, operationId, payload, organizationId,
                executionId, clock.instant(), callback);
        GroupKey key = new GroupKey(type, organizationId);
        List<BatchOperation> full = null;
        synchronized (pendingLock) {
            if (closed) {
                return false;
            }
            List<BatchOperation> group = pending.computeIfAbsent(key, k -> new ArrayList<>());
            group.add(op);
            if (group.size() >= config.maxBatchSize()) {
                full = pending.remove(key);
            }
        }
        if (full != null) {
            logger.log(Level.FINE, "Group {0} reached {1} operations, flushing", new Object[]{key, full.size()});
            flushGroup(key, full);
        }
        return true;
    }

    /**
     * Flushes every group whose oldest operation waited at least {@code maxWaitTime}.
     * Runs on the background flusher; may also be called directly.
     */
    public void flushExpired() {
        Instant cutoff = clock.instant().minus(config.maxWaitTime());
        Map<GroupKey, List<BatchOperation>> due = new LinkedHashMap<>();
        synchronized (pendingLock) {
            pending.entrySet().removeIf(entry -> {
                if (entry.getValue().isEmpty()) {
                    return true;
                }
                Instant oldest = entry.getValue().get(0).createdAt();
                if (!oldest.isAfter(cutoff)) {
                    due.put(entry.getKey(), entry.getValue());
                    return true;
                }
                return false;
            });
        }
        due.forEach(this::flushGroupSafely);
    }

    /**
     * Flushes all buffered operations.
     *
     * @return number of operations flushed
     */
    public int flushAll() {
        Map<GroupKey, List<BatchOperation>> all;
        synchronized (pendingLock) {
            all = new LinkedHashMap<>(pending);
            pending.clear();
        }
        int count = 0;
        for (Map.Entry<GroupKey, List<BatchOperation>> entry : all.entrySet()) {
            count += entry.getValue().size();
            flushGroupSafely(entry.getKey(), entry.getValue());
        }
        return count;
    }

    /**
     * Flushes all buffered operations of one type, across organizations.
     *
     * @return number of operations flushed
     */
    public int flushByType(OperationType type) {
        Map<GroupKey, List<BatchOperation>> selected = new LinkedHashMap<>();
        synchronized (pendingLock) {
            pending.entrySet().removeIf(entry -> {
                if (entry.getKey().type() == type) {
                    selected.put(entry.getKey(), entry.getValue());
                    return true;
                }
                return false;
            });
        }
        int count = 0;
        for (Map.Entry<GroupKey, List<BatchOperation>> entry : selected.entrySet()) {
            count += entry.getValue().size();
            flushGroupSafely(entry.getKey(), entry.getValue());
        }
        return count;
    }

    public BatchStats stats() {
        Map<String, Integer> byGroup = new LinkedHashMap<>();
        synchronized (pendingLock) {
            pending.entrySet().stream()
                    .sorted(Comparator.comparing(e -> e.getKey().toString()))
                    .forEach(e -> byGroup.put(e.getKey().toString(), e.getValue().size()));
        }
        return new BatchStats(byGroup, flushes.get(), operationsFlushed.get(), operationsFailed.get(),
                flushTask != null && !closed);
    }

    /**
     * Stops the background flusher and synchronously flushes everything still buffered.
     * Operations enqueued after this call are rejected.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            synchronized (pendingLock) {
                closed = true;
            }
            if (flushTask != null) {
                flushTask.cancel(false);
            }
            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
        int flushed = flushAll();
        if (flushed > 0) {
            logger.log(Level.INFO, "Flushed {0} pending operations on shutdown", flushed);
        }
    }

    private void flushGroupSafely(GroupKey key, List<BatchOperation> operations) {
        try {
            flushGroup(key, operations);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error flushing group " + key, e);
        }
    }

    private void flushGroup(GroupKey key, List<BatchOperation> operations) {
        if (operations.isEmpty()) {
            return;
        }
        ReentrantLock lock = groupLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            List<OperationOutcome> outcomes = invokeHandler(key, operations);
            flushes.incrementAndGet();
            operationsFlushed.addAndGet(operations.size());
            boolean allSucceeded = true;
            for (int i = 0; i < operations.size(); i++) {
                BatchOperation op = operations.get(i);
                OperationOutcome outcome = i < outcomes.size() && outcomes.get(i) != null
                        ? outcomes.get(i)
                        : OperationOutcome.failed(op.operationId(), "Handler returned no outcome");
                if (!outcome.success()) {
                    allSucceeded = false;
                    operationsFailed.incrementAndGet();
                }
                notifyCallback(op, outcome);
            }
            metrics.recordBatchFlush(key.type(), operations.size(), allSucceeded);
        } finally {
            lock.unlock();
        }
    }

    private List<OperationOutcome> invokeHandler(GroupKey key, List<BatchOperation> operations) {
        BatchHandler handler = handlers.handlerFor(key.type());
        if (handler == null) {
            logger.log(Level.WARNING, "No batch handler registered for {0}; failing {1} operations",
                    new Object[]{key.type(), operations.size()});
            return failAll(operations, "No handler registered for " + key.type());
        }
        try {
            List<OperationOutcome> outcomes = handler.handle(key.organizationId(), operations);
            return outcomes != null ? outcomes : List.of();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Batch handler failed for group " + key
                    + " (" + operations.size() + " operations)", e);
            return failAll(operations, String.valueOf(e.getMessage()));
        }
    }

    private static List<OperationOutcome> failAll(List<BatchOperation> operations, String error) {
        List<OperationOutcome> failed = new ArrayList<>(operations.size());
        for (BatchOperation op : operations) {
            failed.add(OperationOutcome.failed(op.operationId(), error));
        }
        return failed;
    }

    private static void notifyCallback(BatchOperation op, OperationOutcome outcome) {
        try {
            op.callback().onComplete(op, outcome);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Completion callback failed for operation " + op.operationId(), e);
        }
    }

    private record GroupKey(OperationType type, String organizationId) {
        @Override
        public String toString() {
            return type + ":" + organizationId;
        }
    }

    /** Builder for {@link BatchAggregator}. */
    public static final class Builder {
        private BatchHandlerRegistry handlers;
        private BatchConfig config;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the handler registry. <b>Required.</b>
         */
        public Builder handlers(BatchHandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        /**
         * Optional. Defaults to {@link BatchConfig#DEFAULT}.
         */
        public Builder config(BatchConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional clock for operation timestamps. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public BatchAggregator build() {
            return new BatchAggregator(this);
        }
    }
}
