package io.workgate;

import io.workgate.spi.TaskQueue;
import io.workgate.spi.TaskQueueException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Task queue whose answers are scripted per test. Records every submission.
 */
public class StubTaskQueue implements TaskQueue {
    public final List<Map<String, String>> submissions = new CopyOnWriteArrayList<>();
    public final AtomicInteger statusQueries = new AtomicInteger();
    private final AtomicInteger ids = new AtomicInteger();
    private volatile Function<String, TaskStatus> statusAnswer;
    private final AtomicInteger failSubmissions = new AtomicInteger();

    public StubTaskQueue(Function<String, TaskStatus> statusAnswer) {
        this.statusAnswer = statusAnswer;
    }

    public static StubTaskQueue succeeding() {
        return new StubTaskQueue(id -> TaskStatus.of(TaskState.SUCCEEDED));
    }

    public StubTaskQueue failFirstSubmissions(int count) {
        failSubmissions.set(count);
        return this;
    }

    public void answer(Function<String, TaskStatus> statusAnswer) {
        this.statusAnswer = statusAnswer;
    }

    @Override
    public String submit(String taskName, Map<String, String> arguments) {
        if (failSubmissions.getAndDecrement() > 0) {
            throw new TaskQueueException("broker unavailable");
        }
        submissions.add(arguments);
        return taskName + "-" + ids.incrementAndGet();
    }

    @Override
    public TaskStatus status(String trackingId) {
        statusQueries.incrementAndGet();
        return statusAnswer.apply(trackingId);
    }
}
