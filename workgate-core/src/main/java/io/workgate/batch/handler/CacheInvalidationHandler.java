package io.workgate.batch.handler;

import io.workgate.batch.BatchHandler;
import io.workgate.batch.BatchOperation;
import io.workgate.batch.OperationOutcome;
import io.workgate.spi.CacheClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deletes cache entries. The payload carries either a {@code key} or a {@code prefix}.
 */
public final class CacheInvalidationHandler implements BatchHandler {
    private final CacheClient cache;

    public CacheInvalidationHandler(CacheClient cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public List<OperationOutcome> handle(String organizationId, List<BatchOperation> operations) {
        List<OperationOutcome> outcomes = new ArrayList<>(operations.size());
        for (BatchOperation op : operations) {
            String key = op.payloadString("key");
            String prefix = op.payloadString("prefix");
            try {
                if (key != null) {
                    cache.delete(key);
                } else if (prefix != null && !prefix.isEmpty()) {
                    cache.deleteAll(cache.keysWithPrefix(prefix));
                } else {
                    outcomes.add(OperationOutcome.failed(op.operationId(), "Missing key or prefix"));
                    continue;
                }
                outcomes.add(OperationOutcome.ok(op.operationId()));
            } catch (RuntimeException e) {
                outcomes.add(OperationOutcome.failed(op.operationId(), String.valueOf(e.getMessage())));
            }
        }
        return outcomes;
    }
}
