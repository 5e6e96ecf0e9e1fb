/**
 * Incremental discovery with early termination.
 *
 * <p>{@link io.workgate.discovery.StreamingDiscovery} interleaves directory listing with
 * micro-batch filtering and stops at the hard limit.
 */
package io.workgate.discovery;
