package io.workgate.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.workgate.micrometer.MicrometerMetricsExporter;
import io.workgate.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code workgate.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link WorkGateAutoConfiguration} so the {@link MetricsExporter} bean is
 * available to the coordinator.
 */
@AutoConfiguration
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "workgate.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WorkGateProperties.class)
public class WorkGateMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, WorkGateProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
