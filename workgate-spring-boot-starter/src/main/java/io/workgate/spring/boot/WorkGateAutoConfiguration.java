package io.workgate.spring.boot;

import io.workgate.WorkGate;
import io.workgate.batch.BatchConfig;
import io.workgate.cache.InMemoryCacheClient;
import io.workgate.dead.DeadLetterManager;
import io.workgate.execution.ExecutionConfig;
import io.workgate.resilience.CircuitBreakerRegistry;
import io.workgate.resilience.ExponentialBackoffRetryPolicy;
import io.workgate.resilience.FixedBackoffRetryPolicy;
import io.workgate.resilience.RetryPolicy;
import io.workgate.source.LocalFileSystemSource;
import io.workgate.spi.CacheClient;
import io.workgate.spi.ControlPlaneClient;
import io.workgate.spi.DeadLetterStore;
import io.workgate.spi.ItemSource;
import io.workgate.spi.MetricsExporter;
import io.workgate.spi.TaskQueue;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the {@link WorkGate} coordinator.
 *
 * <p>Requires a {@link TaskQueue} bean from the application and a
 * {@link ControlPlaneClient}, either the application's own or the HTTP client from
 * {@link WorkGateHttpAutoConfiguration}. The lease cache and dead-letter store come from
 * {@link WorkGateJdbcAutoConfiguration} when a DataSource is present; otherwise
 * process-local implementations are used.
 *
 * @see WorkGateProperties
 */
@AutoConfiguration(after = {
        WorkGateJdbcAutoConfiguration.class,
        WorkGateHttpAutoConfiguration.class,
        WorkGateMicrometerAutoConfiguration.class})
@ConditionalOnClass(WorkGate.class)
@ConditionalOnBean({ControlPlaneClient.class, TaskQueue.class})
@EnableConfigurationProperties(WorkGateProperties.class)
public class WorkGateAutoConfiguration {
    private static final Logger logger = Logger.getLogger(WorkGateAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public ItemSource workGateItemSource() {
        return new LocalFileSystemSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheClient workGateCacheClient() {
        logger.log(Level.WARNING, "No shared CacheClient configured; leases are process-local "
                + "and will not coordinate across workers");
        return new InMemoryCacheClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry workGateCircuitBreakers(WorkGateProperties props,
            ObjectProvider<MetricsExporter> metricsProvider) {
        WorkGateProperties.CircuitBreaker cb = props.getCircuitBreaker();
        return new CircuitBreakerRegistry(cb.getFailureThreshold(), cb.getCoolDown(), cb.getSuccessThreshold(),
                Clock.systemUTC(), metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public WorkGate workGate(WorkGateProperties props,
            ItemSource itemSource,
            CacheClient cacheClient,
            ControlPlaneClient controlPlane,
            TaskQueue taskQueue,
            CircuitBreakerRegistry circuitBreakers,
            ObjectProvider<DeadLetterStore> deadLetterStoreProvider,
            ObjectProvider<MetricsExporter> metricsProvider) {

        WorkGateProperties.Batch batch = props.getBatch();
        WorkGateProperties.Execution ex = props.getExecution();
        WorkGateProperties.ControlPlane cp = props.getControlPlane();

        WorkGate.Builder builder = WorkGate.builder()
                .itemSource(itemSource)
                .cache(cacheClient)
                .controlPlane(controlPlane)
                .taskQueue(taskQueue)
                .circuitBreakers(circuitBreakers)
                .controlPlaneRetryPolicy(new ExponentialBackoffRetryPolicy(cp.getBaseDelayMs(), cp.getMaxDelayMs()))
                .controlPlaneMaxAttempts(cp.getMaxAttempts())
                .leaseTtl(props.getLock().getTtl())
                .batchConfig(new BatchConfig(batch.getMaxBatchSize(), batch.getMaxWaitTime(),
                        batch.getFlushInterval(), batch.isAutoFlush()))
                .executionConfig(ExecutionConfig.builder()
                        .taskTimeout(ex.getTaskTimeout())
                        .pollIntervalStart(ex.getPollIntervalStart())
                        .pollIntervalMax(ex.getPollIntervalMax())
                        .pollBackoffFactor(ex.getPollBackoffFactor())
                        .maxPollAttempts(ex.getMaxPollAttempts())
                        .taskRetryAttempts(ex.getTaskRetryAttempts())
                        .taskRetryBackoff(ex.getTaskRetryBackoff())
                        .taskRetryPolicy(taskRetryPolicy(ex))
                        .retryExecutionFailures(ex.isRetryExecutionFailures())
                        .schedulerThreads(ex.getSchedulerThreads())
                        .build());
        DeadLetterStore deadLetterStore = deadLetterStoreProvider.getIfAvailable();
        if (deadLetterStore != null) {
            builder.deadLetterStore(deadLetterStore);
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    /**
     * {@code null} keeps the engine's linear default.
     */
    static RetryPolicy taskRetryPolicy(WorkGateProperties.Execution ex) {
        if (ex.getTaskRetryBackoffType() == WorkGateProperties.RetryBackoff.FIXED) {
            return new FixedBackoffRetryPolicy(ex.getTaskRetryBackoff().toMillis());
        }
        return null;
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterManager workGateDeadLetterManager(WorkGate workGate) {
        return workGate.deadLetters();
    }

    @Bean
    @ConditionalOnMissingBean
    public DiscoveryDefaults workGateDiscoveryDefaults(WorkGateProperties props) {
        return new DiscoveryDefaults(props.getDiscovery());
    }
}
