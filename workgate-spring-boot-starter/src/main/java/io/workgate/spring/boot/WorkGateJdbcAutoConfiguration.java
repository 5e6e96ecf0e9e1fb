package io.workgate.spring.boot;

import io.workgate.jdbc.ConnectionProvider;
import io.workgate.jdbc.DataSourceConnectionProvider;
import io.workgate.jdbc.cache.JdbcCacheClient;
import io.workgate.jdbc.dead.JdbcDeadLetterStore;
import io.workgate.jdbc.dialect.CacheDialects;
import io.workgate.jdbc.purge.JdbcPurgeScheduler;
import io.workgate.jdbc.spi.CacheDialect;
import io.workgate.spi.CacheClient;
import io.workgate.spi.DeadLetterStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Backs the lease cache and the dead-letter store with the application's DataSource.
 *
 * <p>Active when {@code workgate-jdbc} is on the classpath, a DataSource exists and
 * {@code workgate.jdbc.enabled} is true (default). The dialect is detected from the JDBC
 * URL. The tables must exist; see {@link JdbcCacheClient} and {@link JdbcDeadLetterStore}
 * for their layout.
 *
 * <p>The purge scheduler covers whichever of the two JDBC components are in use. Set
 * {@code workgate.jdbc.purge.enabled=false} when both are replaced by custom beans.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcCacheClient.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "workgate.jdbc", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WorkGateProperties.class)
public class WorkGateJdbcAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CacheDialect workGateCacheDialect(DataSource dataSource) {
        return CacheDialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider workGateConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(CacheClient.class)
    public JdbcCacheClient workGateCacheClient(ConnectionProvider connectionProvider, CacheDialect dialect,
            WorkGateProperties props) {
        return JdbcCacheClient.builder()
                .connectionProvider(connectionProvider)
                .dialect(dialect)
                .tableName(props.getJdbc().getCacheTable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterStore.class)
    public JdbcDeadLetterStore workGateDeadLetterStore(ConnectionProvider connectionProvider, CacheDialect dialect,
            WorkGateProperties props) {
        return JdbcDeadLetterStore.builder()
                .connectionProvider(connectionProvider)
                .dialect(dialect)
                .tableName(props.getJdbc().getDeadLetterTable())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "workgate.jdbc.purge", name = "enabled", matchIfMissing = true)
    public JdbcPurgeScheduler workGatePurgeScheduler(WorkGateProperties props,
            ObjectProvider<JdbcCacheClient> cacheClient,
            ObjectProvider<JdbcDeadLetterStore> deadLetterStore) {
        WorkGateProperties.Purge purge = props.getJdbc().getPurge();
        return JdbcPurgeScheduler.builder()
                .cacheClient(cacheClient.getIfAvailable())
                .deadLetterStore(deadLetterStore.getIfAvailable())
                .deadLetterRetention(purge.getDeadLetterRetention())
                .batchSize(purge.getBatchSize())
                .intervalSeconds(purge.getIntervalSeconds())
                .build();
    }
}
