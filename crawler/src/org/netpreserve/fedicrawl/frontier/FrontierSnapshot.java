package org.netpreserve.fedicrawl.frontier;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Serialized form of {@link FrontierState}.
 */
record FrontierSnapshot(int maxDepth, int currentDepth, List<List<FrontierNode>> queues, List<String> visited,
                        CrawlCounters counters, @Nullable NodeProgress inProgress) {
}
