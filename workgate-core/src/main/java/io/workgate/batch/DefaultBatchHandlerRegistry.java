package io.workgate.batch;

import io.workgate.batch.handler.CacheInvalidationHandler;
import io.workgate.batch.handler.FileStatusUpdateHandler;
import io.workgate.batch.handler.PipelineUpdateHandler;
import io.workgate.batch.handler.StatusUpdateHandler;
import io.workgate.spi.CacheClient;
import io.workgate.spi.ControlPlaneClient;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thread-safe handler registry. Registering a second handler for a type replaces the first.
 */
public final class DefaultBatchHandlerRegistry implements BatchHandlerRegistry {
    private final Map<OperationType, BatchHandler> handlers = new EnumMap<>(OperationType.class);

    /**
     * Registry with the built-in handler for every operation type.
     */
    public static DefaultBatchHandlerRegistry standard(ControlPlaneClient controlPlane,
            CacheClient cache) {
        return new DefaultBatchHandlerRegistry()
                .register(OperationType.STATUS_UPDATE, new StatusUpdateHandler(controlPlane))
                .register(OperationType.PIPELINE_UPDATE, new PipelineUpdateHandler(controlPlane))
                .register(OperationType.FILE_STATUS_UPDATE, new FileStatusUpdateHandler(controlPlane))
                .register(OperationType.CACHE_INVALIDATION, new CacheInvalidationHandler(cache));
    }

    public synchronized DefaultBatchHandlerRegistry register(OperationType type, BatchHandler handler) {
        handlers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    @Override
    public synchronized BatchHandler handlerFor(OperationType type) {
        return handlers.get(type);
    }
}
