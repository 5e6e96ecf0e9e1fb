package io.workgate.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.workgate.micrometer.MicrometerMetricsExporter;
import io.workgate.spi.MetricsExporter;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class WorkGateMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WorkGateMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("workgate.metrics.name-prefix=ingest.workgate").run(ctx -> {
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("ingest.workgate.task.succeeded").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("workgate.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenExporterAlreadyDefined() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
            assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void coordinatorPicksUpExporter() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        WorkGateMicrometerAutoConfiguration.class, WorkGateAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class,
                        StubBeans.TaskQueueConfig.class, StubBeans.ControlPlaneConfig.class)
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertTrue(ctx.containsBean("workGate"));
                    assertTrue(ctx.containsBean("micrometerMetricsExporter"));
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
