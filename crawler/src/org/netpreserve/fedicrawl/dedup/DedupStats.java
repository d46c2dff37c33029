package org.netpreserve.fedicrawl.dedup;

/**
 * @param checked        {@code isDuplicate} calls
 * @param filterHits     calls the filter couldn't rule out, each costing a store lookup
 * @param duplicates     calls confirmed by a live record
 * @param added          {@code markProcessed} calls
 * @param storeErrors    store operations that failed and fell back to in-process state
 * @param estimatedFalsePositiveRate filter false-positive probability at its current fill
 */
public record DedupStats(Namespace namespace, long checked, long filterHits, long duplicates, long added,
                         long storeErrors, double estimatedFalsePositiveRate) {
}
