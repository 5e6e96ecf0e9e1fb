package io.workgate.model;

import java.util.Objects;

/**
 * A candidate unit of work found by discovery.
 *
 * @param sourcePath        path within the item source
 * @param providerIdentity  content hash or provider-assigned id, may be {@code null}
 * @param size              size in bytes, or {@code -1} if unknown
 * @param mimeType          detected MIME type, may be {@code null}
 * @param discoverySequence position in discovery order, used for deterministic truncation
 * @param destinationHint   optional output location hint, may be {@code null}
 */
public record WorkItem(
        String sourcePath,
        String providerIdentity,
        long size,
        String mimeType,
        long discoverySequence,
        String destinationHint) {

    public WorkItem {
        Objects.requireNonNull(sourcePath, "sourcePath");
    }

    public ItemKey key() {
        return new ItemKey(providerIdentity, sourcePath);
    }

    /**
     * Returns the base name of {@link #sourcePath()}.
     */
    public String name() {
        int idx = sourcePath.lastIndexOf('/');
        return idx >= 0 ? sourcePath.substring(idx + 1) : sourcePath;
    }
}
