/**
 * Client-side write batching.
 *
 * <p>{@link io.workgate.batch.BatchAggregator} buffers status writes per operation type
 * and tenant and flushes them through the {@link io.workgate.batch.BatchHandler}
 * registered for the type. Built-in handlers live in {@code io.workgate.batch.handler}.
 */
package io.workgate.batch;
