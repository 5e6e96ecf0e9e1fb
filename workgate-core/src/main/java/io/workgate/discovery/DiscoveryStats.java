package io.workgate.discovery;

/**
 * Counters of one discovery pass.
 *
 * @param directoriesListed  directories successfully listed
 * @param directoriesFailed  directories that could not be listed and were skipped
 * @param itemsDiscovered    non-directory entries seen
 * @param itemsMatched       entries that passed the name pattern
 * @param batchesFiltered    micro-batches handed to the filter pipeline
 * @param itemsFilteredOut   matched items the pipeline removed
 * @param limitReached       whether the walk stopped at the hard limit
 */
public record DiscoveryStats(
        int directoriesListed,
        int directoriesFailed,
        int itemsDiscovered,
        int itemsMatched,
        int batchesFiltered,
        int itemsFilteredOut,
        boolean limitReached) {
}
