package io.workgate.spi;

import io.workgate.batch.OperationType;
import io.workgate.model.FailureType;

/**
 * Observability hook for exporting WorkGate counters to a metrics backend.
 *
 * <p>Dead-letter insertions, circuit-breaker openings and fully filtered-out discovery
 * runs each look like "no work happened" to an operator, so each has its own signal.
 * The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /**
     * Records one discovery pass.
     *
     * @param matched   items that passed the name pattern
     * @param survivors items that passed every filter and fit in the limit
     */
    void recordDiscovery(int matched, int survivors);

    /**
     * A discovery pass matched items but every one of them was filtered out.
     */
    void incrementAllFilteredOut();

    void recordClaims(int created, int errors);

    default void recordLeasesReleased(int released) {
    }

    void recordBatchFlush(OperationType type, int size, boolean success);

    void incrementTaskSucceeded();

    default void incrementTaskRetried() {
    }

    void incrementDeadLettered(FailureType failureType);

    void incrementCircuitOpened(String operationName);

    final class Noop implements MetricsExporter {
        @Override
        public void recordDiscovery(int matched, int survivors) {
        }

        @Override
        public void incrementAllFilteredOut() {
        }

        @Override
        public void recordClaims(int created, int errors) {
        }

        @Override
        public void recordBatchFlush(OperationType type, int size, boolean success) {
        }

        @Override
        public void incrementTaskSucceeded() {
        }

        @Override
        public void incrementDeadLettered(FailureType failureType) {
        }

        @Override
        public void incrementCircuitOpened(String operationName) {
        }
    }
}
