package io.workgate.batch;

import java.time.Duration;
import java.util.Objects;

/**
 * Flush thresholds of a {@link BatchAggregator}.
 *
 * @param maxBatchSize  group size that triggers an immediate flush
 * @param maxWaitTime   age of a group's oldest operation that triggers a timed flush
 * @param flushInterval how often the background flusher checks group ages
 * @param autoFlush     whether the background flusher runs at all
 */
public record BatchConfig(int maxBatchSize, Duration maxWaitTime, Duration flushInterval,
        boolean autoFlush) {

    public static final BatchConfig DEFAULT =
            new BatchConfig(10, Duration.ofSeconds(5), Duration.ofSeconds(2), true);

    public BatchConfig {
        Objects.requireNonNull(maxWaitTime, "maxWaitTime");
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1, got: " + maxBatchSize);
        }
        if (maxWaitTime.isNegative()) {
            throw new IllegalArgumentException("maxWaitTime must be >= 0");
        }
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be > 0");
        }
    }
}
