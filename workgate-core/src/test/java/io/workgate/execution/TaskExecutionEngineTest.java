package io.workgate.execution;

import io.workgate.RecordingMetrics;
import io.workgate.StubTaskQueue;
import io.workgate.dead.InMemoryDeadLetterStore;
import io.workgate.model.DeadLetterEntry;
import io.workgate.model.FailureType;
import io.workgate.resilience.CircuitBreakerRegistry;
import io.workgate.resilience.RetryPolicy;
import io.workgate.spi.DeadLetterStore;
import io.workgate.spi.MetricsExporter;
import io.workgate.spi.TaskQueueException;
import io.workgate.spi.TaskQueue.TaskState;
import io.workgate.spi.TaskQueue.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TaskExecutionEngineTest {

    private final InMemoryDeadLetterStore deadLetters = new InMemoryDeadLetterStore();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private TaskExecutionEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static ExecutionConfig.Builder fastConfig() {
        return ExecutionConfig.builder()
                .taskTimeout(Duration.ofMillis(200))
                .pollIntervalStart(Duration.ofMillis(10))
                .pollIntervalMax(Duration.ofMillis(20))
                .taskRetryAttempts(3)
                .taskRetryBackoff(Duration.ofMillis(1));
    }

    private TaskExecutionEngine engine(StubTaskQueue queue, ExecutionConfig config) {
        return TaskExecutionEngine.builder()
                .taskQueue(queue)
                .deadLetters(deadLetters)
                .config(config)
                .metrics(metrics)
                .build();
    }

    private static TaskOutcome await(CompletableFuture<TaskOutcome> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Test
    void successCompletesWithTrackingId() throws Exception {
        StubTaskQueue queue = StubTaskQueue.succeeding();
        engine = engine(queue, fastConfig().build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of("file_path", "/a"))));

        TaskOutcome.Succeeded succeeded = assertInstanceOf(TaskOutcome.Succeeded.class, outcome);
        assertEquals("process_file-1", succeeded.trackingId());
        assertEquals(1, succeeded.unit().attemptCount());
        assertEquals(List.of(Map.of("file_path", "/a")), queue.submissions);
        assertEquals(1, metrics.tasksSucceeded.get());
        assertEquals(0, deadLetters.count(null));
    }

    @Test
    void lostTaskIsRetriedThenDeadLetteredAsTimeout() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> TaskStatus.of(TaskState.PENDING));
        engine = engine(queue, fastConfig().build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of("file_path", "/a"))));

        TaskOutcome.DeadLettered dead = assertInstanceOf(TaskOutcome.DeadLettered.class, outcome);
        assertEquals(3, queue.submissions.size());
        assertEquals(3, dead.entry().attemptsMade());
        assertEquals("timeout", dead.entry().failureType().code());
        assertEquals(FailureClassification.TRANSIENT_LOST, dead.unit().failureClassification());
        assertEquals(1, deadLetters.count("process_file"));
        assertEquals(2, metrics.tasksRetried.get());
        assertEquals(List.of(FailureType.TIMEOUT), metrics.deadLettered);
    }

    @Test
    void retryDelaysComeFromConfiguredPolicy() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> TaskStatus.failed("flaky"));
        List<Integer> asked = new CopyOnWriteArrayList<>();
        RetryPolicy policy = attempts -> {
            asked.add(attempts);
            return 1L;
        };
        engine = engine(queue, fastConfig().retryExecutionFailures(true).taskRetryPolicy(policy).build());

        assertInstanceOf(TaskOutcome.DeadLettered.class,
                await(engine.submit(RetryableUnit.of("process_file", Map.of()))));

        assertEquals(List.of(1, 2), asked);
    }

    @Test
    void rejectedDeadLetterIsReported() throws Exception {
        DeadLetterStore rejecting = new DeadLetterStore() {
            @Override
            public void insert(DeadLetterEntry entry) {
                throw new IllegalStateException("store down");
            }

            @Override
            public Optional<DeadLetterEntry> find(String id) {
                return Optional.empty();
            }

            @Override
            public List<DeadLetterEntry> query(String operationName, int limit) {
                return List.of();
            }

            @Override
            public boolean delete(String id) {
                return false;
            }

            @Override
            public int count(String operationName) {
                return 0;
            }

            @Override
            public int purgeOlderThan(Instant cutoff) {
                return 0;
            }
        };
        engine = TaskExecutionEngine.builder()
                .taskQueue(new StubTaskQueue(id -> TaskStatus.failed("corrupt pdf")))
                .deadLetters(rejecting)
                .config(fastConfig().build())
                .metrics(metrics)
                .build();

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        TaskOutcome.DeadLetterFailed failed = assertInstanceOf(TaskOutcome.DeadLetterFailed.class, outcome);
        assertEquals("store down", failed.storeError());
        assertEquals("corrupt pdf", failed.entry().failureReason());
        assertFalse(outcome.succeeded());
        assertTrue(metrics.deadLettered.isEmpty());
    }

    @Test
    void executedFailureIsNotRetried() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> TaskStatus.failed("corrupt pdf"));
        engine = engine(queue, fastConfig().build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        DeadLetterEntry entry = assertInstanceOf(TaskOutcome.DeadLettered.class, outcome).entry();
        assertEquals(1, queue.submissions.size());
        assertEquals("execution_error", entry.failureType().code());
        assertEquals("corrupt pdf", entry.failureReason());
        assertEquals(1, entry.attemptsMade());
    }

    @Test
    void executedFailureRetriedWhenEnabled() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> TaskStatus.failed("flaky"));
        engine = engine(queue, fastConfig().retryExecutionFailures(true).build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        assertInstanceOf(TaskOutcome.DeadLettered.class, outcome);
        assertEquals(3, queue.submissions.size());
        assertEquals(FailureClassification.EXECUTED_AND_FAILED, outcome.unit().failureClassification());
    }

    @Test
    void submissionFailureIsRetried() throws Exception {
        StubTaskQueue queue = StubTaskQueue.succeeding().failFirstSubmissions(2);
        engine = engine(queue, fastConfig().build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        assertTrue(outcome.succeeded());
        assertEquals(3, outcome.unit().attemptCount());
    }

    @Test
    void submissionFailuresExhaustAsCommunicationError() throws Exception {
        StubTaskQueue queue = StubTaskQueue.succeeding().failFirstSubmissions(10);
        engine = engine(queue, fastConfig().build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        assertEquals(FailureType.COMMUNICATION_ERROR,
                assertInstanceOf(TaskOutcome.DeadLettered.class, outcome).entry().failureType());
    }

    @Test
    void openCircuitDeadLettersWithoutSubmitting() throws Exception {
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(1, Duration.ofMinutes(5), 1,
                Clock.systemUTC(), MetricsExporter.NOOP);
        breakers.get(TaskExecutionEngine.SUBMIT_OPERATION).forceOpen();
        StubTaskQueue queue = StubTaskQueue.succeeding();
        engine = TaskExecutionEngine.builder()
                .taskQueue(queue)
                .deadLetters(deadLetters)
                .circuitBreakers(breakers)
                .config(fastConfig().build())
                .build();

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        assertEquals(FailureType.CIRCUIT_OPEN,
                assertInstanceOf(TaskOutcome.DeadLettered.class, outcome).entry().failureType());
        assertTrue(queue.submissions.isEmpty());
    }

    @Test
    void statusQueryFailuresKeepPolling() throws Exception {
        AtomicInteger answers = new AtomicInteger();
        StubTaskQueue queue = new StubTaskQueue(id -> {
            if (answers.incrementAndGet() < 3) {
                throw new TaskQueueException("status unavailable");
            }
            return TaskStatus.of(TaskState.SUCCEEDED);
        });
        engine = engine(queue, fastConfig().taskTimeout(Duration.ofSeconds(5)).build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        assertTrue(outcome.succeeded());
        assertEquals(1, queue.submissions.size());
        assertEquals(3, queue.statusQueries.get());
    }

    @Test
    void maxPollAttemptsBoundsAnAttempt() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> TaskStatus.of(TaskState.RUNNING));
        engine = engine(queue, fastConfig()
                .taskTimeout(Duration.ofMinutes(5))
                .maxPollAttempts(2)
                .taskRetryAttempts(1)
                .build());

        TaskOutcome outcome = await(engine.submit(RetryableUnit.of("process_file", Map.of())));

        assertEquals(FailureType.TIMEOUT,
                assertInstanceOf(TaskOutcome.DeadLettered.class, outcome).entry().failureType());
        assertEquals(2, queue.statusQueries.get());
    }

    @Test
    void cancelStopsUnit() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> TaskStatus.of(TaskState.PENDING));
        engine = engine(queue, fastConfig().taskTimeout(Duration.ofMinutes(5)).build());
        RetryableUnit unit = RetryableUnit.of("process_file", Map.of());
        CompletableFuture<TaskOutcome> future = engine.submit(unit);

        assertTrue(engine.cancel(unit.unitId()));

        assertInstanceOf(TaskOutcome.Cancelled.class, await(future));
        assertFalse(engine.cancel(unit.unitId()));
        assertEquals(0, deadLetters.count(null));
    }

    @Test
    void duplicateUnitIdRejected() {
        engine = engine(new StubTaskQueue(id -> TaskStatus.of(TaskState.PENDING)),
                fastConfig().taskTimeout(Duration.ofMinutes(5)).build());
        RetryableUnit unit = RetryableUnit.of("process_file", Map.of());
        engine.submit(unit);

        assertThrows(IllegalArgumentException.class, () -> engine.submit(unit));
        assertEquals(1, engine.inFlightCount());
    }

    @Test
    void closeCancelsInFlightAndRejectsNewUnits() throws Exception {
        engine = engine(new StubTaskQueue(id -> TaskStatus.of(TaskState.PENDING)),
                fastConfig().taskTimeout(Duration.ofMinutes(5)).build());
        CompletableFuture<TaskOutcome> future = engine.submit(RetryableUnit.of("process_file", Map.of()));

        engine.close();

        assertInstanceOf(TaskOutcome.Cancelled.class, await(future));
        assertThrows(IllegalStateException.class,
                () -> engine.submit(RetryableUnit.of("process_file", Map.of())));
    }

    @Test
    void fanInRunsCallbackWithGroupCounts() throws Exception {
        StubTaskQueue queue = new StubTaskQueue(id -> id.startsWith("bad")
                ? TaskStatus.failed("nope") : TaskStatus.of(TaskState.SUCCEEDED));
        engine = engine(queue, fastConfig().build());
        CountDownLatch done = new CountDownLatch(1);

        CompletableFuture<FanInResult> future = engine.submitGroup(
                List.of(RetryableUnit.of("good", Map.of("i", "1")),
                        RetryableUnit.of("bad", Map.of("i", "2")),
                        RetryableUnit.of("good", Map.of("i", "3"))),
                RetryableUnit.of("aggregate", Map.of("execution_id", "exec-1")));
        future.thenRun(done::countDown);

        FanInResult result = future.get(10, TimeUnit.SECONDS);
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertEquals(2, result.succeededMembers());
        assertTrue(result.callback().succeeded());
        Map<String, String> callbackArgs = queue.submissions.get(queue.submissions.size() - 1);
        assertEquals("3", callbackArgs.get("group_size"));
        assertEquals("2", callbackArgs.get("group_succeeded"));
        assertEquals("exec-1", callbackArgs.get("execution_id"));
    }

    @Test
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionConfig.builder().taskRetryAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionConfig.builder().pollBackoffFactor(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionConfig.builder()
                .pollIntervalStart(Duration.ofSeconds(10)).pollIntervalMax(Duration.ofSeconds(1)).build());
        RetryPolicy linear = ExecutionConfig.builder().taskRetryBackoff(Duration.ofSeconds(5)).build().taskRetryPolicy();
        assertEquals(5_000, linear.computeDelayMs(1));
        assertEquals(10_000, linear.computeDelayMs(2));
        assertEquals(15_000, linear.computeDelayMs(9));
        assertEquals(30_000, ExecutionConfig.defaults().nextPollDelayMs(25_000));
    }
}
