package io.workgate;

import io.workgate.batch.OperationType;
import io.workgate.model.FailureType;
import io.workgate.spi.MetricsExporter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MetricsExporter that keeps what it was told, for assertions.
 */
public final class RecordingMetrics implements MetricsExporter {
    public final AtomicInteger discoveries = new AtomicInteger();
    public final AtomicInteger allFilteredOut = new AtomicInteger();
    public final AtomicInteger claimsCreated = new AtomicInteger();
    public final AtomicInteger claimErrors = new AtomicInteger();
    public final AtomicInteger leasesReleased = new AtomicInteger();
    public final AtomicInteger flushedOperations = new AtomicInteger();
    public final AtomicInteger failedFlushes = new AtomicInteger();
    public final AtomicInteger tasksSucceeded = new AtomicInteger();
    public final AtomicInteger tasksRetried = new AtomicInteger();
    public final List<FailureType> deadLettered = new CopyOnWriteArrayList<>();
    public final List<String> circuitsOpened = new CopyOnWriteArrayList<>();

    @Override
    public void recordDiscovery(int matched, int survivors) {
        discoveries.incrementAndGet();
    }

    @Override
    public void incrementAllFilteredOut() {
        allFilteredOut.incrementAndGet();
    }

    @Override
    public void recordClaims(int created, int errors) {
        claimsCreated.addAndGet(created);
        claimErrors.addAndGet(errors);
    }

    @Override
    public void recordLeasesReleased(int released) {
        leasesReleased.addAndGet(released);
    }

    @Override
    public void recordBatchFlush(OperationType type, int size, boolean success) {
        flushedOperations.addAndGet(size);
        if (!success) {
            failedFlushes.incrementAndGet();
        }
    }

    @Override
    public void incrementTaskSucceeded() {
        tasksSucceeded.incrementAndGet();
    }

    @Override
    public void incrementTaskRetried() {
        tasksRetried.incrementAndGet();
    }

    @Override
    public void incrementDeadLettered(FailureType failureType) {
        deadLettered.add(failureType);
    }

    @Override
    public void incrementCircuitOpened(String operationName) {
        circuitsOpened.add(operationName);
    }
}
