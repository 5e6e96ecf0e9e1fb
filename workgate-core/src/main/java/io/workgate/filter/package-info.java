/**
 * Filters applied to discovered micro-batches: deduplication, processing history and
 * fleet-wide active leases.
 */
package io.workgate.filter;
