/**
 * WorkGate: worker-side coordination of document workflow executions.
 *
 * <p>The {@link io.workgate.WorkGate} composite wires the components together:
 * <ol>
 *   <li>{@link io.workgate.discovery.StreamingDiscovery} walks the item source and stops
 *       at the hard limit;</li>
 *   <li>{@link io.workgate.filter.FilterPipeline} removes duplicates, items with blocking
 *       history and items leased by other executions;</li>
 *   <li>{@link io.workgate.lock.ActiveItemLockManager} leases the final batch in the
 *       shared cache;</li>
 *   <li>{@link io.workgate.execution.TaskExecutionEngine} submits each item with retries,
 *       circuit breakers and dead-letter routing;</li>
 *   <li>{@link io.workgate.batch.BatchAggregator} turns status events into batched
 *       control-plane writes.</li>
 * </ol>
 *
 * <p>Collaborators are plugged in through the interfaces in {@code io.workgate.spi}.
 */
package io.workgate;
