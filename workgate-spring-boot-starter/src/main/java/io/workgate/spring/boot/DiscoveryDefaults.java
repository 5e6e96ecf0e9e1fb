package io.workgate.spring.boot;

import io.workgate.discovery.DiscoveryRequest;

import java.util.List;
import java.util.Objects;

/**
 * Builds {@link DiscoveryRequest}s from the configured {@code workgate.discovery.*} defaults.
 */
public final class DiscoveryDefaults {
    private final WorkGateProperties.Discovery discovery;

    public DiscoveryDefaults(WorkGateProperties.Discovery discovery) {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
    }

    public DiscoveryRequest request(List<String> roots) {
        return new DiscoveryRequest(roots, discovery.getPatterns(), discovery.isRecursive(),
                discovery.getMaxFiles(), discovery.getMicroBatchSize());
    }

    public DiscoveryRequest request(List<String> roots, int maxFiles) {
        return new DiscoveryRequest(roots, discovery.getPatterns(), discovery.isRecursive(),
                maxFiles, discovery.getMicroBatchSize());
    }
}
