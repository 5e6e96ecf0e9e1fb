package io.workgate.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WorkGate.
 *
 * @see WorkGateAutoConfiguration
 */
@ConfigurationProperties(prefix = "workgate")
public class WorkGateProperties {

    private final Discovery discovery = new Discovery();
    private final Lock lock = new Lock();
    private final Batch batch = new Batch();
    private final Execution execution = new Execution();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final ControlPlane controlPlane = new ControlPlane();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public Discovery getDiscovery() {
        return discovery;
    }

    public Lock getLock() {
        return lock;
    }

    public Batch getBatch() {
        return batch;
    }

    public Execution getExecution() {
        return execution;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public ControlPlane getControlPlane() {
        return controlPlane;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Discovery {
        /**
         * Base-name globs; empty matches everything.
         */
        private List<String> patterns = new ArrayList<>();
        private boolean recursive = true;
        /**
         * Stop discovery once this many items survive filtering.
         */
        private int maxFiles = 100;
        private int microBatchSize = 100;

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public boolean isRecursive() {
            return recursive;
        }

        public void setRecursive(boolean recursive) {
            this.recursive = recursive;
        }

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
        }

        public int getMicroBatchSize() {
            return microBatchSize;
        }

        public void setMicroBatchSize(int microBatchSize) {
            this.microBatchSize = microBatchSize;
        }
    }

    public static class Lock {
        /**
         * Lease TTL. Unset means the environment override or the built-in default.
         */
        private Duration ttl;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Batch {
        private int maxBatchSize = 10;
        private Duration maxWaitTime = Duration.ofSeconds(5);
        private Duration flushInterval = Duration.ofSeconds(2);
        private boolean autoFlush = true;

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public Duration getMaxWaitTime() {
            return maxWaitTime;
        }

        public void setMaxWaitTime(Duration maxWaitTime) {
            this.maxWaitTime = maxWaitTime;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public boolean isAutoFlush() {
            return autoFlush;
        }

        public void setAutoFlush(boolean autoFlush) {
            this.autoFlush = autoFlush;
        }
    }

    public static class Execution {
        private Duration taskTimeout = Duration.ofSeconds(300);
        private Duration pollIntervalStart = Duration.ofSeconds(1);
        private Duration pollIntervalMax = Duration.ofSeconds(30);
        private double pollBackoffFactor = 1.5;
        private int maxPollAttempts = 1000;
        /**
         * Total attempts per unit, the first one included.
         */
        private int taskRetryAttempts = 3;
        private Duration taskRetryBackoff = Duration.ofSeconds(5);
        /**
         * LINEAR waits {@code taskRetryBackoff * attempts}; FIXED waits {@code taskRetryBackoff}.
         */
        private RetryBackoff taskRetryBackoffType = RetryBackoff.LINEAR;
        private boolean retryExecutionFailures;
        private int schedulerThreads = 2;

        public Duration getTaskTimeout() {
            return taskTimeout;
        }

        public void setTaskTimeout(Duration taskTimeout) {
            this.taskTimeout = taskTimeout;
        }

        public Duration getPollIntervalStart() {
            return pollIntervalStart;
        }

        public void setPollIntervalStart(Duration pollIntervalStart) {
            this.pollIntervalStart = pollIntervalStart;
        }

        public Duration getPollIntervalMax() {
            return pollIntervalMax;
        }

        public void setPollIntervalMax(Duration pollIntervalMax) {
            this.pollIntervalMax = pollIntervalMax;
        }

        public double getPollBackoffFactor() {
            return pollBackoffFactor;
        }

        public void setPollBackoffFactor(double pollBackoffFactor) {
            this.pollBackoffFactor = pollBackoffFactor;
        }

        public int getMaxPollAttempts() {
            return maxPollAttempts;
        }

        public void setMaxPollAttempts(int maxPollAttempts) {
            this.maxPollAttempts = maxPollAttempts;
        }

        public int getTaskRetryAttempts() {
            return taskRetryAttempts;
        }

        public void setTaskRetryAttempts(int taskRetryAttempts) {
            this.taskRetryAttempts = taskRetryAttempts;
        }

        public Duration getTaskRetryBackoff() {
            return taskRetryBackoff;
        }

        public void setTaskRetryBackoff(Duration taskRetryBackoff) {
            this.taskRetryBackoff = taskRetryBackoff;
        }

        public RetryBackoff getTaskRetryBackoffType() {
            return taskRetryBackoffType;
        }

        public void setTaskRetryBackoffType(RetryBackoff taskRetryBackoffType) {
            this.taskRetryBackoffType = taskRetryBackoffType;
        }

        public boolean isRetryExecutionFailures() {
            return retryExecutionFailures;
        }

        public void setRetryExecutionFailures(boolean retryExecutionFailures) {
            this.retryExecutionFailures = retryExecutionFailures;
        }

        public int getSchedulerThreads() {
            return schedulerThreads;
        }

        public void setSchedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
        }
    }

    public enum RetryBackoff {
        LINEAR,
        FIXED
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(60);
        private int successThreshold = 1;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }
    }

    public static class ControlPlane {
        /**
         * Root of the internal API. The HTTP client is only created when this is set.
         */
        private String baseUrl;
        private String apiKey;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private long maxDelayMs = 10_000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Jdbc {
        /**
         * Use the DataSource for the lease cache and dead letters.
         */
        private boolean enabled = true;
        private String cacheTable = "workgate_cache";
        private String deadLetterTable = "workgate_dead_letter";
        private final Purge purge = new Purge();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCacheTable() {
            return cacheTable;
        }

        public void setCacheTable(String cacheTable) {
            this.cacheTable = cacheTable;
        }

        public String getDeadLetterTable() {
            return deadLetterTable;
        }

        public void setDeadLetterTable(String deadLetterTable) {
            this.deadLetterTable = deadLetterTable;
        }

        public Purge getPurge() {
            return purge;
        }
    }

    public static class Purge {
        private boolean enabled = true;
        private Duration deadLetterRetention = Duration.ofHours(24);
        private int batchSize = 500;
        private long intervalSeconds = 300;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDeadLetterRetention() {
            return deadLetterRetention;
        }

        public void setDeadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = deadLetterRetention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "workgate";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
