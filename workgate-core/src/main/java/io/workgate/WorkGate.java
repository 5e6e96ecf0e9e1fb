package io.workgate;

import io.workgate.batch.BatchAggregator;
import io.workgate.batch.BatchConfig;
import io.workgate.batch.DefaultBatchHandlerRegistry;
import io.workgate.batch.OperationType;
import io.workgate.dead.DeadLetterManager;
import io.workgate.dead.InMemoryDeadLetterStore;
import io.workgate.discovery.DiscoveryResult;
import io.workgate.discovery.StreamingDiscovery;
import io.workgate.execution.ExecutionConfig;
import io.workgate.execution.RetryableUnit;
import io.workgate.execution.TaskExecutionEngine;
import io.workgate.execution.TaskOutcome;
import io.workgate.filter.FilterContext;
import io.workgate.filter.FilterPipeline;
import io.workgate.lock.ActiveItemLockManager;
import io.workgate.lock.ClaimResult;
import io.workgate.model.ExecutionStatus;
import io.workgate.model.WorkItem;
import io.workgate.resilience.CircuitBreakerRegistry;
import io.workgate.resilience.ExponentialBackoffRetryPolicy;
import io.workgate.resilience.ResilientControlPlaneClient;
import io.workgate.resilience.RetryPolicy;
import io.workgate.spi.CacheClient;
import io.workgate.spi.ControlPlaneClient;
import io.workgate.spi.DeadLetterStore;
import io.workgate.spi.ItemSource;
import io.workgate.spi.MetricsExporter;
import io.workgate.spi.TaskQueue;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires discovery, filtering, leasing, task execution and
 * status batching into one {@link AutoCloseable} unit.
 *
 * <p>{@link #run} performs one execution: discover and filter up to the hard limit,
 * claim the final batch, submit every item through the {@link TaskExecutionEngine},
 * report per-item and per-execution status through the {@link BatchAggregator}, and
 * release each item's lease when its task finishes.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (WorkGate gate = WorkGate.builder()
 *     .itemSource(new LocalFileSystemSource())
 *     .cache(cache)
 *     .controlPlane(controlPlane)
 *     .taskQueue(taskQueue)
 *     .build()) {
 *   ExecutionReport report = gate.run(request).join();
 * }
 * }</pre>
 */
public final class WorkGate implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WorkGate.class.getName());

    private final ControlPlaneClient controlPlane;
    private final ActiveItemLockManager lockManager;
    private final StreamingDiscovery discovery;
    private final BatchAggregator aggregator;
    private final TaskExecutionEngine engine;
    private final DeadLetterManager deadLetters;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MetricsExporter metrics;

    private WorkGate(ControlPlaneClient controlPlane, ActiveItemLockManager lockManager,
            StreamingDiscovery discovery, BatchAggregator aggregator, TaskExecutionEngine engine,
            DeadLetterManager deadLetters, CircuitBreakerRegistry circuitBreakers, MetricsExporter metrics) {
        this.controlPlane = controlPlane;
        this.lockManager = lockManager;
        this.discovery = discovery;
        this.aggregator = aggregator;
        this.engine = engine;
        this.deadLetters = deadLetters;
        this.circuitBreakers = circuitBreakers;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one execution. Discovery, filtering and claiming happen on the calling thread;
     * the returned future completes when every submitted item reached a terminal outcome.
     */
    public CompletableFuture<ExecutionReport> run(ExecutionRequest request) {
        Objects.requireNonNull(request, "request");
        FilterContext context = new FilterContext(request.workflowId(), request.executionId(),
                request.organizationId());
        FilterPipeline pipeline = FilterPipeline.standard(controlPlane, lockManager, request.useHistory(), true);
        DiscoveryResult discovered = discovery.discover(request.discovery(), pipeline, context);

        if (discovered.allFilteredOut()) {
            metrics.incrementAllFilteredOut();
            logger.log(Level.INFO, "All {0} matched items were filtered out for workflow {1} (execution {2})",
                    new Object[]{discovered.stats().itemsMatched(), request.workflowId(), request.executionId()});
        }
        List<WorkItem> batch = discovered.items();
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(new ExecutionReport(request.workflowId(),
                    request.executionId(), discovered.stats(), 0, 0, 0, 0, 0, 0));
        }

        ClaimResult claim = lockManager.claim(batch, request.workflowId(), request.executionId());
        if (!claim.unleased().isEmpty()) {
            logger.log(Level.WARNING, "{0} items run without a lease; concurrent executions may pick them up",
                    claim.unleased().size());
        }
        enqueueExecutionStatus(request, ExecutionStatus.EXECUTING, batch.size());

        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>(batch.size());
        for (WorkItem item : batch) {
            futures.add(engine.submit(RetryableUnit.of(request.taskName(), taskArguments(request, item)))
                    .whenComplete((outcome, error) -> finishItem(request, item, outcome)));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> {
                    int succeeded = 0;
                    int deadLettered = 0;
                    int unrecorded = 0;
                    int cancelled = 0;
                    for (CompletableFuture<TaskOutcome> future : futures) {
                        TaskOutcome outcome = future.isCompletedExceptionally() ? null : future.join();
                        if (outcome instanceof TaskOutcome.Succeeded) {
                            succeeded++;
                        } else if (outcome instanceof TaskOutcome.DeadLettered) {
                            deadLettered++;
                        } else if (outcome instanceof TaskOutcome.DeadLetterFailed) {
                            unrecorded++;
                        } else {
                            cancelled++;
                        }
                    }
                    ExecutionStatus finalStatus = succeeded == 0 ? ExecutionStatus.ERROR : ExecutionStatus.COMPLETED;
                    enqueueExecutionStatus(request, finalStatus, batch.size());
                    return new ExecutionReport(request.workflowId(), request.executionId(), discovered.stats(),
                            batch.size(), claim.stats().created(), succeeded, deadLettered, unrecorded, cancelled);
                });
    }

    private void finishItem(ExecutionRequest request, WorkItem item, TaskOutcome outcome) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("file_path", item.sourcePath());
        if (item.providerIdentity() != null) {
            payload.put("provider_file_uuid", item.providerIdentity());
        }
        if (outcome instanceof TaskOutcome.Succeeded) {
            payload.put("status", ExecutionStatus.COMPLETED.name());
        } else if (outcome instanceof TaskOutcome.DeadLettered dead) {
            payload.put("status", ExecutionStatus.ERROR.name());
            payload.put("error_message", dead.entry().failureReason());
        } else if (outcome instanceof TaskOutcome.DeadLetterFailed unstored) {
            payload.put("status", ExecutionStatus.ERROR.name());
            payload.put("error_message", unstored.entry().failureReason());
        } else {
            payload.put("status", ExecutionStatus.STOPPED.name());
        }
        String operationId = outcome != null ? outcome.unit().unitId() : item.sourcePath();
        aggregator.enqueue(OperationType.FILE_STATUS_UPDATE, operationId, payload,
                request.organizationId(), request.executionId(), null);
        lockManager.releaseItems(List.of(item), request.workflowId());
    }

    private void enqueueExecutionStatus(ExecutionRequest request, ExecutionStatus status, int totalFiles) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("execution_id", request.executionId());
        payload.put("workflow_id", request.workflowId());
        payload.put("status", status.name());
        payload.put("total_files", totalFiles);
        aggregator.enqueue(OperationType.STATUS_UPDATE, request.executionId() + ":" + status.name(), payload,
                request.organizationId(), request.executionId(), null);
    }

    private static Map<String, String> taskArguments(ExecutionRequest request, WorkItem item) {
        Map<String, String> args = new LinkedHashMap<>();
        args.put("workflow_id", request.workflowId());
        args.put("execution_id", request.executionId());
        args.put("organization_id", request.organizationId());
        args.put("file_path", item.sourcePath());
        args.put("file_size", Long.toString(item.size()));
        if (item.providerIdentity() != null) {
            args.put("provider_file_uuid", item.providerIdentity());
        }
        if (item.mimeType() != null) {
            args.put("mime_type", item.mimeType());
        }
        if (item.destinationHint() != null) {
            args.put("destination", item.destinationHint());
        }
        return args;
    }

    public ActiveItemLockManager lockManager() {
        return lockManager;
    }

    public BatchAggregator aggregator() {
        return aggregator;
    }

    public TaskExecutionEngine engine() {
        return engine;
    }

    public DeadLetterManager deadLetters() {
        return deadLetters;
    }

    public CircuitBreakerRegistry circuitBreakers() {
        return circuitBreakers;
    }

    /**
     * Shuts down in order: execution engine (in-flight units complete as cancelled), then
     * the aggregator (final flush), then the metrics exporter if it is closeable.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            engine.close();
        } catch (RuntimeException e) {
            first = e;
        }
        try {
            aggregator.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /** Builder for {@link WorkGate}. */
    public static final class Builder {
        private ItemSource itemSource;
        private CacheClient cache;
        private ControlPlaneClient controlPlane;
        private TaskQueue taskQueue;
        private DeadLetterStore deadLetterStore;
        private MetricsExporter metrics;
        private CircuitBreakerRegistry circuitBreakers;
        private RetryPolicy controlPlaneRetryPolicy;
        private int controlPlaneMaxAttempts = 3;
        private Duration leaseTtl;
        private BatchConfig batchConfig;
        private ExecutionConfig executionConfig;
        private Clock clock;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder itemSource(ItemSource itemSource) {
            this.itemSource = itemSource;
            return this;
        }

        /** Shared lease cache. <b>Required.</b> */
        public Builder cache(CacheClient cache) {
            this.cache = cache;
            return this;
        }

        /** <b>Required.</b> Wrapped with per-method circuit breakers and retries. */
        public Builder controlPlane(ControlPlaneClient controlPlane) {
            this.controlPlane = controlPlane;
            return this;
        }

        /** <b>Required.</b> */
        public Builder taskQueue(TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        /** Optional. Defaults to an {@link InMemoryDeadLetterStore}. */
        public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
            this.deadLetterStore = deadLetterStore;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to threshold 5 and a 60s cool-down for every operation. */
        public Builder circuitBreakers(CircuitBreakerRegistry circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
            return this;
        }

        /** Backoff between control-plane retries. Defaults to exponential 500ms..10s. */
        public Builder controlPlaneRetryPolicy(RetryPolicy controlPlaneRetryPolicy) {
            this.controlPlaneRetryPolicy = controlPlaneRetryPolicy;
            return this;
        }

        /** Total attempts for a transiently failing control-plane call. Default 3. */
        public Builder controlPlaneMaxAttempts(int controlPlaneMaxAttempts) {
            this.controlPlaneMaxAttempts = controlPlaneMaxAttempts;
            return this;
        }

        /** Lease TTL. See {@link ActiveItemLockManager.Builder#ttl}. */
        public Builder leaseTtl(Duration leaseTtl) {
            this.leaseTtl = leaseTtl;
            return this;
        }

        public Builder batchConfig(BatchConfig batchConfig) {
            this.batchConfig = batchConfig;
            return this;
        }

        public Builder executionConfig(ExecutionConfig executionConfig) {
            this.executionConfig = executionConfig;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the components and starts the aggregator's background flusher.
         */
        public WorkGate build() {
            Objects.requireNonNull(itemSource, "itemSource");
            Objects.requireNonNull(cache, "cache");
            Objects.requireNonNull(controlPlane, "controlPlane");
            Objects.requireNonNull(taskQueue, "taskQueue");
            MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
            Clock c = clock != null ? clock : Clock.systemUTC();
            CircuitBreakerRegistry breakers = circuitBreakers != null
                    ? circuitBreakers : new CircuitBreakerRegistry(5, Duration.ofSeconds(60), 1, c, m);
            RetryPolicy retryPolicy = controlPlaneRetryPolicy != null
                    ? controlPlaneRetryPolicy : new ExponentialBackoffRetryPolicy(500, 10_000);
            ControlPlaneClient resilient = new ResilientControlPlaneClient(controlPlane, breakers,
                    retryPolicy, controlPlaneMaxAttempts);
            DeadLetterStore store = deadLetterStore != null ? deadLetterStore : new InMemoryDeadLetterStore();

            ActiveItemLockManager lockManager = ActiveItemLockManager.builder()
                    .cache(cache)
                    .controlPlane(resilient)
                    .ttl(leaseTtl)
                    .metrics(m)
                    .clock(c)
                    .build();
            BatchAggregator aggregator = BatchAggregator.builder()
                    .handlers(DefaultBatchHandlerRegistry.standard(resilient, cache))
                    .config(batchConfig)
                    .metrics(m)
                    .clock(c)
                    .build();
            TaskExecutionEngine engine = TaskExecutionEngine.builder()
                    .taskQueue(taskQueue)
                    .deadLetters(store)
                    .circuitBreakers(breakers)
                    .config(executionConfig)
                    .metrics(m)
                    .clock(c)
                    .build();
            try {
                aggregator.start();
            } catch (RuntimeException e) {
                engine.close();
                throw e;
            }
            return new WorkGate(resilient, lockManager, new StreamingDiscovery(itemSource, m), aggregator,
                    engine, new DeadLetterManager(store, engine, c), breakers, m);
        }
    }
}
