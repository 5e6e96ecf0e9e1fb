package io.workgate.spring.boot;

import io.workgate.http.HttpControlPlaneClient;
import io.workgate.spi.ControlPlaneClient;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates an {@link HttpControlPlaneClient} when {@code workgate-http} is on the
 * classpath and {@code workgate.control-plane.base-url} is set.
 */
@AutoConfiguration
@ConditionalOnClass(HttpControlPlaneClient.class)
@ConditionalOnProperty(prefix = "workgate.control-plane", name = "base-url")
@EnableConfigurationProperties(WorkGateProperties.class)
public class WorkGateHttpAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ControlPlaneClient.class)
    public HttpControlPlaneClient workGateControlPlaneClient(WorkGateProperties props) {
        WorkGateProperties.ControlPlane cp = props.getControlPlane();
        if (cp.getApiKey() == null || cp.getApiKey().isEmpty()) {
            throw new IllegalStateException("workgate.control-plane.api-key must be set with base-url");
        }
        return HttpControlPlaneClient.builder()
                .baseUrl(cp.getBaseUrl())
                .apiKey(cp.getApiKey())
                .requestTimeout(cp.getRequestTimeout())
                .build();
    }
}
