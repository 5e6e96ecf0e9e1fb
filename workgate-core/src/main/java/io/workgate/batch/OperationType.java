package io.workgate.batch;

/**
 * Kinds of write operations the {@link BatchAggregator} groups and flushes.
 */
public enum OperationType {
    STATUS_UPDATE,
    PIPELINE_UPDATE,
    FILE_STATUS_UPDATE,
    CACHE_INVALIDATION
}
