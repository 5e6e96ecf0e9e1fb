package io.workgate.execution;

import io.workgate.model.DeadLetterEntry;
import io.workgate.model.FailureType;
import io.workgate.resilience.CircuitBreakerRegistry;
import io.workgate.resilience.CircuitOpenException;
import io.workgate.spi.DeadLetterStore;
import io.workgate.spi.MetricsExporter;
import io.workgate.spi.TaskQueue;
import io.workgate.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Submits units of work to the {@link TaskQueue} and drives each one to a terminal
 * {@link TaskOutcome}.
 *
 * <p>Per unit: SUBMIT, then POLL with capped geometric backoff until the task is
 * SUCCEEDED or FAILED, or until the attempt is LOST because neither the wall-clock
 * timeout nor the poll budget was enough to confirm it. LOST attempts are retried after
 * the delay of the configured {@link io.workgate.resilience.RetryPolicy} up to {@code taskRetryAttempts} attempts in total. FAILED attempts go to
 * the dead-letter store right away unless {@code retryExecutionFailures} is set. A unit
 * that runs out of attempts is dead-lettered with the failure type of its last attempt;
 * if the store rejects the entry the unit completes as {@link TaskOutcome.DeadLetterFailed}.
 *
 * <p>Submission and status queries each go through their own circuit breaker
 * ({@value #SUBMIT_OPERATION}, {@value #STATUS_OPERATION}). Every step runs as a
 * scheduled task on one shared scheduler, so waiting units hold no thread. Units can be
 * cancelled between steps; a task already running remotely is not recalled.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class TaskExecutionEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TaskExecutionEngine.class.getName());

    public static final String SUBMIT_OPERATION = "task-queue.submit";
    public static final String STATUS_OPERATION = "task-queue.status";

    private final TaskQueue taskQueue;
    private final DeadLetterStore deadLetters;
    private final CircuitBreakerRegistry breakers;
    private final ExecutionConfig config;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, UnitRun> inFlight = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private TaskExecutionEngine(Builder builder) {
        this.taskQueue = Objects.requireNonNull(builder.taskQueue, "taskQueue");
        this.deadLetters = Objects.requireNonNull(builder.deadLetters, "deadLetters");
        this.breakers = builder.breakers != null ? builder.breakers : new CircuitBreakerRegistry();
        this.config = builder.config != null ? builder.config : ExecutionConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.scheduler = Executors.newScheduledThreadPool(config.schedulerThreads(),
                new DaemonThreadFactory("workgate-task-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionConfig config() {
        return config;
    }

    /**
     * Starts driving {@code unit}. Cancelling the returned future cancels the unit.
     *
     * @throws IllegalStateException    if the engine is closed
     * @throws IllegalArgumentException if a unit with the same id is already in flight
     */
    public CompletableFuture<TaskOutcome> submit(RetryableUnit unit) {
        Objects.requireNonNull(unit, "unit");
        if (closed) {
            throw new IllegalStateException("TaskExecutionEngine has been closed");
        }
        UnitRun run = new UnitRun(unit);
        if (inFlight.putIfAbsent(unit.unitId(), run) != null) {
            throw new IllegalArgumentException("Unit already in flight: " + unit.unitId());
        }
        run.result.whenComplete((outcome, error) -> {
            inFlight.remove(unit.unitId(), run);
            if (run.result.isCancelled()) {
                run.stop();
            }
        });
        run.schedule(run::startAttempt, 0L);
        return run.result;
    }

    /**
     * Submits every member independently and, once all of them reached a terminal
     * outcome, submits {@code callback}. The callback receives its own arguments plus
     * {@code group_size} and {@code group_succeeded}.
     */
    public CompletableFuture<FanInResult> submitGroup(List<RetryableUnit> members, RetryableUnit callback) {
        Objects.requireNonNull(members, "members");
        Objects.requireNonNull(callback, "callback");
        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>(members.size());
        for (RetryableUnit member : members) {
            futures.add(submit(member));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenCompose(ignored -> {
                    List<TaskOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
                    long succeeded = outcomes.stream().filter(TaskOutcome::succeeded).count();
                    Map<String, String> arguments = new HashMap<>(callback.arguments());
                    arguments.put("group_size", Integer.toString(outcomes.size()));
                    arguments.put("group_succeeded", Long.toString(succeeded));
                    RetryableUnit fanIn = new RetryableUnit(callback.unitId(), callback.operationName(),
                            arguments, 0, null, null);
                    return submit(fanIn).thenApply(result -> new FanInResult(outcomes, result));
                });
    }

    /**
     * Cancels a unit between steps.
     *
     * @return {@code true} if the unit was in flight
     */
    public boolean cancel(String unitId) {
        UnitRun run = inFlight.get(unitId);
        if (run == null) {
            return false;
        }
        run.stop();
        run.complete(new TaskOutcome.Cancelled(run.unit));
        return true;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Stops the scheduler. Units still in flight complete as {@link TaskOutcome.Cancelled}.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdownNow();
        for (UnitRun run : List.copyOf(inFlight.values())) {
            run.complete(new TaskOutcome.Cancelled(run.unit));
        }
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.log(Level.WARNING, "Task scheduler did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * State of one unit. Steps run strictly one after another, each scheduling the next.
     */
    private final class UnitRun {
        private final CompletableFuture<TaskOutcome> result = new CompletableFuture<>();
        private volatile RetryableUnit unit;
        private volatile boolean stopped;
        private ScheduledFuture<?> pending;

        private String trackingId;
        private int polls;
        private long attemptStartedNanos;
        private long pollDelayMs;

        UnitRun(RetryableUnit unit) {
            this.unit = unit;
        }

        synchronized void schedule(Runnable step, long delayMs) {
            if (stopped || result.isDone()) {
                return;
            }
            try {
                pending = scheduler.schedule(() -> runStep(step), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                complete(new TaskOutcome.Cancelled(unit));
            }
        }

        synchronized void stop() {
            stopped = true;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        void complete(TaskOutcome outcome) {
            result.complete(outcome);
        }

        private void runStep(Runnable step) {
            if (stopped || result.isDone()) {
                return;
            }
            try {
                step.run();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error driving unit " + unit.unitId(), e);
                deadLetter(FailureType.COMMUNICATION_ERROR, "Unexpected error: " + e);
            }
        }

        void startAttempt() {
            trackingId = null;
            polls = 0;
            attemptStartedNanos = System.nanoTime();
            pollDelayMs = config.pollIntervalStart().toMillis();
            try {
                trackingId = breakers.get(SUBMIT_OPERATION)
                        .execute(() -> taskQueue.submit(unit.operationName(), unit.arguments()));
            } catch (CircuitOpenException e) {
                lost(FailureType.CIRCUIT_OPEN, e.getMessage());
                return;
            } catch (RuntimeException e) {
                lost(FailureType.COMMUNICATION_ERROR, "Submission failed: " + e.getMessage());
                return;
            }
            logger.log(Level.FINE, "Unit {0} submitted as {1} (attempt {2})",
                    new Object[]{unit.unitId(), trackingId, unit.attemptCount() + 1});
            schedulePoll();
        }

        void poll() {
            long timeoutMs = config.taskTimeout().toMillis();
            if (elapsedMs() >= timeoutMs || polls >= config.maxPollAttempts()) {
                lost(FailureType.TIMEOUT, "Task " + trackingId + " not confirmed after " + polls
                        + " polls and " + elapsedMs() + "ms");
                return;
            }
            polls++;
            TaskQueue.TaskStatus status;
            try {
                status = breakers.get(STATUS_OPERATION).execute(() -> taskQueue.status(trackingId));
            } catch (RuntimeException e) {
                logger.log(Level.FINE, "Status query for {0} failed: {1}", new Object[]{trackingId, e.getMessage()});
                backOffAndPoll();
                return;
            }
            TaskQueue.TaskState state = status == null ? TaskQueue.TaskState.PENDING : status.state();
            switch (state) {
                case SUCCEEDED -> succeed();
                case FAILED -> failed(status.error());
                case PENDING, RUNNING -> backOffAndPoll();
            }
        }

        private void backOffAndPoll() {
            pollDelayMs = config.nextPollDelayMs(pollDelayMs);
            schedulePoll();
        }

        private void schedulePoll() {
            long remainingMs = config.taskTimeout().toMillis() - elapsedMs();
            schedule(this::poll, Math.max(0L, Math.min(pollDelayMs, remainingMs)));
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - attemptStartedNanos);
        }

        private void succeed() {
            unit = unit.succeededAttempt();
            metrics.incrementTaskSucceeded();
            complete(new TaskOutcome.Succeeded(unit, trackingId));
        }

        private void lost(FailureType type, String error) {
            unit = unit.failedAttempt(error, FailureClassification.TRANSIENT_LOST);
            retryOrDeadLetter(type, error);
        }

        private void failed(String error) {
            String reason = error != null ? error : "Task failed without error detail";
            unit = unit.failedAttempt(reason, FailureClassification.EXECUTED_AND_FAILED);
            if (config.retryExecutionFailures()) {
                retryOrDeadLetter(FailureType.EXECUTION_ERROR, reason);
            } else {
                deadLetter(FailureType.EXECUTION_ERROR, reason);
            }
        }

        private void retryOrDeadLetter(FailureType type, String error) {
            if (unit.attemptCount() >= config.taskRetryAttempts()) {
                deadLetter(type, error);
                return;
            }
            long delayMs = config.taskRetryPolicy().computeDelayMs(unit.attemptCount());
            metrics.incrementTaskRetried();
            logger.log(Level.INFO, "Unit {0} attempt {1}/{2} failed ({3}), retrying in {4}ms",
                    new Object[]{unit.unitId(), unit.attemptCount(), config.taskRetryAttempts(),
                            type.code(), delayMs});
            schedule(this::startAttempt, delayMs);
        }

        private void deadLetter(FailureType type, String reason) {
            DeadLetterEntry entry = new DeadLetterEntry(UUID.randomUUID().toString(), unit.operationName(),
                    unit.arguments(), reason, type, unit.attemptCount(), clock.instant());
            try {
                deadLetters.insert(entry);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to persist dead letter " + entry, e);
                complete(new TaskOutcome.DeadLetterFailed(unit, entry, String.valueOf(e.getMessage())));
                return;
            }
            metrics.incrementDeadLettered(type);
            logger.log(Level.WARNING, "Unit {0} ({1}) dead-lettered as {2} after {3} attempts: {4}",
                    new Object[]{unit.unitId(), unit.operationName(), type.code(), unit.attemptCount(), reason});
            complete(new TaskOutcome.DeadLettered(unit, entry));
        }
    }

    /** Builder for {@link TaskExecutionEngine}. */
    public static final class Builder {
        private TaskQueue taskQueue;
        private DeadLetterStore deadLetters;
        private CircuitBreakerRegistry breakers;
        private ExecutionConfig config;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder taskQueue(TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        /** <b>Required.</b> */
        public Builder deadLetters(DeadLetterStore deadLetters) {
            this.deadLetters = deadLetters;
            return this;
        }

        /**
         * Optional. Defaults to a registry with threshold 5 and a 60s cool-down.
         */
        public Builder circuitBreakers(CircuitBreakerRegistry breakers) {
            this.breakers = breakers;
            return this;
        }

        public Builder config(ExecutionConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Clock for dead-letter timestamps. Timeouts always use {@link System#nanoTime()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TaskExecutionEngine build() {
            return new TaskExecutionEngine(this);
        }
    }
}
