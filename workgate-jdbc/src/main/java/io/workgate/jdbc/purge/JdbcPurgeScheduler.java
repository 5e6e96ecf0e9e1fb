package io.workgate.jdbc.purge;

import io.workgate.jdbc.cache.JdbcCacheClient;
import io.workgate.jdbc.dead.JdbcDeadLetterStore;
import io.workgate.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled housekeeping for the JDBC tables: removes expired lease rows and dead letters
 * older than the retention period.
 *
 * <p>Each cycle deletes in batches (default 500) until a batch comes back short, then
 * sleeps until the next interval. Either target may be omitted.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JdbcPurgeScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JdbcPurgeScheduler.class.getName());

    private final JdbcCacheClient cacheClient;
    private final JdbcDeadLetterStore deadLetterStore;
    private final Duration deadLetterRetention;
    private final int batchSize;
    private final long intervalSeconds;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> purgeTask;
    private volatile boolean closed;

    private JdbcPurgeScheduler(Builder builder) {
        if (builder.cacheClient == null && builder.deadLetterStore == null) {
            throw new IllegalArgumentException("cacheClient or deadLetterStore is required");
        }
        if (builder.deadLetterRetention == null || builder.deadLetterRetention.isNegative()) {
            throw new IllegalArgumentException("deadLetterRetention must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.cacheClient = builder.cacheClient;
        this.deadLetterStore = builder.deadLetterStore;
        this.deadLetterRetention = builder.deadLetterRetention;
        this.batchSize = builder.batchSize;
        this.intervalSeconds = builder.intervalSeconds;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JdbcPurgeScheduler has been closed");
        }
        if (purgeTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("workgate-purge-"));
        purgeTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Runs a single purge cycle. May be invoked directly for one-off purges.
     */
    public void runOnce() {
        if (closed) {
            return;
        }
        if (cacheClient != null) {
            try {
                long removed = drain(cacheClient::purgeExpired);
                if (removed > 0) {
                    logger.log(Level.INFO, "Purged {0} expired rows from {1}",
                            new Object[]{removed, cacheClient.tableName()});
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Cache purge cycle failed", e);
            }
        }
        if (deadLetterStore != null) {
            try {
                Instant cutoff = clock.instant().minus(deadLetterRetention);
                long removed = drain(limit -> deadLetterStore.purgeOlderThan(cutoff, limit));
                if (removed > 0) {
                    logger.log(Level.INFO, "Purged {0} dead letters older than {1}",
                            new Object[]{removed, cutoff});
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Dead-letter purge cycle failed", e);
            }
        }
    }

    private long drain(BatchPurge purge) {
        long total = 0;
        int deleted;
        do {
            deleted = purge.purge(batchSize);
            total += deleted;
        } while (deleted >= batchSize && !closed);
        return total;
    }

    /** Cancels the purge schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (purgeTask != null) {
            purgeTask.cancel(false);
            purgeTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @FunctionalInterface
    private interface BatchPurge {
        int purge(int limit);
    }

    /** Builder for {@link JdbcPurgeScheduler}. */
    public static final class Builder {
        private JdbcCacheClient cacheClient;
        private JdbcDeadLetterStore deadLetterStore;
        private Duration deadLetterRetention = Duration.ofHours(24);
        private int batchSize = 500;
        private long intervalSeconds = 300;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Cache whose expired rows are removed. Optional if a dead-letter store is set.
         */
        public Builder cacheClient(JdbcCacheClient cacheClient) {
            this.cacheClient = cacheClient;
            return this;
        }

        /**
         * Dead-letter store to trim. Optional if a cache client is set.
         */
        public Builder deadLetterStore(JdbcDeadLetterStore deadLetterStore) {
            this.deadLetterStore = deadLetterStore;
            return this;
        }

        /**
         * Optional. Defaults to {@code 24 hours}. Must be &ge; 0.
         */
        public Builder deadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = deadLetterRetention;
            return this;
        }

        /**
         * Optional. Defaults to {@code 500}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Optional. Defaults to {@code 300} (5 minutes). Must be &gt; 0.
         */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * Optional. Used to compute the dead-letter cutoff.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JdbcPurgeScheduler build() {
            return new JdbcPurgeScheduler(this);
        }
    }
}
