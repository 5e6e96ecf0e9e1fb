package io.workgate.execution;

import io.workgate.resilience.LinearBackoffRetryPolicy;
import io.workgate.resilience.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling and retry settings of the {@link TaskExecutionEngine}.
 *
 * <p>Use {@link #builder()}; every setting has a default.
 */
public final class ExecutionConfig {
    private final Duration taskTimeout;
    private final Duration pollIntervalStart;
    private final Duration pollIntervalMax;
    private final double pollBackoffFactor;
    private final int maxPollAttempts;
    private final int taskRetryAttempts;
    private final Duration taskRetryBackoff;
    private final RetryPolicy taskRetryPolicy;
    private final boolean retryExecutionFailures;
    private final int schedulerThreads;

    private ExecutionConfig(Builder builder) {
        this.taskTimeout = Objects.requireNonNull(builder.taskTimeout, "taskTimeout");
        this.pollIntervalStart = Objects.requireNonNull(builder.pollIntervalStart, "pollIntervalStart");
        this.pollIntervalMax = Objects.requireNonNull(builder.pollIntervalMax, "pollIntervalMax");
        this.taskRetryBackoff = Objects.requireNonNull(builder.taskRetryBackoff, "taskRetryBackoff");
        if (taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must be > 0");
        }
        if (pollIntervalStart.isZero() || pollIntervalStart.isNegative()) {
            throw new IllegalArgumentException("pollIntervalStart must be > 0");
        }
        if (pollIntervalMax.compareTo(pollIntervalStart) < 0) {
            throw new IllegalArgumentException("pollIntervalMax must be >= pollIntervalStart");
        }
        if (builder.pollBackoffFactor < 1.0) {
            throw new IllegalArgumentException("pollBackoffFactor must be >= 1.0, got: " + builder.pollBackoffFactor);
        }
        if (builder.maxPollAttempts < 1) {
            throw new IllegalArgumentException("maxPollAttempts must be >= 1, got: " + builder.maxPollAttempts);
        }
        if (builder.taskRetryAttempts < 1) {
            throw new IllegalArgumentException("taskRetryAttempts must be >= 1, got: " + builder.taskRetryAttempts);
        }
        if (taskRetryBackoff.isNegative()) {
            throw new IllegalArgumentException("taskRetryBackoff must be >= 0");
        }
        if (builder.schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be >= 1, got: " + builder.schedulerThreads);
        }
        this.pollBackoffFactor = builder.pollBackoffFactor;
        this.maxPollAttempts = builder.maxPollAttempts;
        this.taskRetryAttempts = builder.taskRetryAttempts;
        this.retryExecutionFailures = builder.retryExecutionFailures;
        this.schedulerThreads = builder.schedulerThreads;
        this.taskRetryPolicy = builder.taskRetryPolicy != null
                ? builder.taskRetryPolicy
                : new LinearBackoffRetryPolicy(taskRetryBackoff.toMillis(),
                        taskRetryBackoff.toMillis() * taskRetryAttempts);
    }

    public static ExecutionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration pollIntervalStart() {
        return pollIntervalStart;
    }

    public Duration pollIntervalMax() {
        return pollIntervalMax;
    }

    public double pollBackoffFactor() {
        return pollBackoffFactor;
    }

    public int maxPollAttempts() {
        return maxPollAttempts;
    }

    public int taskRetryAttempts() {
        return taskRetryAttempts;
    }

    public Duration taskRetryBackoff() {
        return taskRetryBackoff;
    }

    /**
     * Delay before each retry of a unit; linear in {@code taskRetryBackoff} unless replaced.
     */
    public RetryPolicy taskRetryPolicy() {
        return taskRetryPolicy;
    }

    public boolean retryExecutionFailures() {
        return retryExecutionFailures;
    }

    public int schedulerThreads() {
        return schedulerThreads;
    }

    long nextPollDelayMs(long currentDelayMs) {
        long next = (long) Math.ceil(currentDelayMs * pollBackoffFactor);
        return Math.min(pollIntervalMax.toMillis(), Math.max(next, 1L));
    }

    /** Builder for {@link ExecutionConfig}. */
    public static final class Builder {
        private Duration taskTimeout = Duration.ofSeconds(300);
        private Duration pollIntervalStart = Duration.ofSeconds(1);
        private Duration pollIntervalMax = Duration.ofSeconds(30);
        private double pollBackoffFactor = 1.5;
        private int maxPollAttempts = 1000;
        private int taskRetryAttempts = 3;
        private Duration taskRetryBackoff = Duration.ofSeconds(5);
        private RetryPolicy taskRetryPolicy;
        private boolean retryExecutionFailures;
        private int schedulerThreads = 2;

        private Builder() {
        }

        /**
         * Wall-clock budget for confirming one attempt. Default 300s.
         */
        public Builder taskTimeout(Duration taskTimeout) {
            this.taskTimeout = taskTimeout;
            return this;
        }

        /** First poll delay after submission. Default 1s. */
        public Builder pollIntervalStart(Duration pollIntervalStart) {
            this.pollIntervalStart = pollIntervalStart;
            return this;
        }

        /** Cap on the poll delay. Default 30s. */
        public Builder pollIntervalMax(Duration pollIntervalMax) {
            this.pollIntervalMax = pollIntervalMax;
            return this;
        }

        /** Factor applied to the poll delay after each pending answer. Default 1.5. */
        public Builder pollBackoffFactor(double pollBackoffFactor) {
            this.pollBackoffFactor = pollBackoffFactor;
            return this;
        }

        /** Poll budget per attempt. Default 1000. */
        public Builder maxPollAttempts(int maxPollAttempts) {
            this.maxPollAttempts = maxPollAttempts;
            return this;
        }

        /** Total attempts for a unit whose task gets lost. Default 3. */
        public Builder taskRetryAttempts(int taskRetryAttempts) {
            this.taskRetryAttempts = taskRetryAttempts;
            return this;
        }

        /** Linear backoff step between attempts. Default 5s. */
        public Builder taskRetryBackoff(Duration taskRetryBackoff) {
            this.taskRetryBackoff = taskRetryBackoff;
            return this;
        }

        /**
         * Replaces the default linear backoff built from {@code taskRetryBackoff}. The policy
         * receives the number of attempts made so far.
         */
        public Builder taskRetryPolicy(RetryPolicy taskRetryPolicy) {
            this.taskRetryPolicy = taskRetryPolicy;
            return this;
        }

        /** Also retry tasks that ran and failed. Default false. */
        public Builder retryExecutionFailures(boolean retryExecutionFailures) {
            this.retryExecutionFailures = retryExecutionFailures;
            return this;
        }

        /** Threads of the shared polling scheduler. Default 2. */
        public Builder schedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public ExecutionConfig build() {
            return new ExecutionConfig(this);
        }
    }
}
