package org.netpreserve.fedicrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.fedicrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * Two-tier deduplication.
 *
 * @param expectedNodes     expected number of distinct nodes, sizes the node filter
 * @param expectedEdges     expected number of distinct edges, sizes the edge filter
 * @param falsePositiveRate target false-positive probability of both filters
 * @param ttl               lifetime of an authoritative record
 */
public record DedupConfig(
        long expectedNodes,
        long expectedEdges,
        double falsePositiveRate,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration ttl
) {
    public DedupConfig {
        Checks.validate("dedup.expectedNodes", expectedNodes, n -> n >= 1);
        Checks.validate("dedup.expectedEdges", expectedEdges, n -> n >= 1);
        Checks.validate("dedup.falsePositiveRate", falsePositiveRate, p -> p > 0 && p < 1);
        Checks.validate("dedup.ttl", ttl, d -> !d.isNegative() && !d.isZero());
    }
}
