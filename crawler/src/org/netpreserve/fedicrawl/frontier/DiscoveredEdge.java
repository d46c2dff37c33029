package org.netpreserve.fedicrawl.frontier;

import org.netpreserve.fedicrawl.api.Direction;

import java.time.Instant;

/**
 * A follow relation: {@code source} follows {@code target}.
 *
 * @param direction which listing revealed the edge
 * @param depth     depth of the node whose listing revealed it
 */
public record DiscoveredEdge(String source, String target, Direction direction, int depth, String strategy,
                             Instant discovered) {
}
