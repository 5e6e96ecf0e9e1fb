package io.workgate.discovery;

import java.util.List;
import java.util.Objects;

/**
 * Parameters of one discovery pass.
 *
 * @param roots          directories to walk, in order
 * @param patterns       base-name globs; empty or {@code ["*"]} matches all
 * @param recursive      walk subdirectories; otherwise only the roots' direct children
 * @param hardLimit      stop once this many survivors have been collected
 * @param microBatchSize matches buffered before the filter pipeline runs
 */
public record DiscoveryRequest(List<String> roots, List<String> patterns, boolean recursive,
        int hardLimit, int microBatchSize) {

    public static final int DEFAULT_MICRO_BATCH_SIZE = 100;

    public DiscoveryRequest {
        Objects.requireNonNull(roots, "roots");
        roots = List.copyOf(roots);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        if (hardLimit < 1) {
            throw new IllegalArgumentException("hardLimit must be >= 1, got: " + hardLimit);
        }
        if (microBatchSize < 1) {
            throw new IllegalArgumentException("microBatchSize must be >= 1, got: " + microBatchSize);
        }
    }
}
