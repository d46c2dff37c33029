package org.netpreserve.fedicrawl.frontier;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Locale;

/**
 * Totals reported when a crawl stops.
 *
 * @param elapsed      time spent in this run, excluding earlier runs of a resumed session
 * @param finalDepth   depth being worked on when the crawl stopped
 * @param checkpointId id of the final checkpoint, null if checkpointing is disabled
 */
public record CrawlResult(String sessionId, Status status, long nodesProcessed, long edgesEmitted,
                          long nodesDiscovered, long duplicatesSkipped, long errors, Duration elapsed,
                          int finalDepth, @Nullable String checkpointId) {

    public enum Status {
        RUNNING, COMPLETED, CANCELLED, BUDGET_EXHAUSTED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
