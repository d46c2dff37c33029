package org.netpreserve.fedicrawl.frontier;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.api.Direction;

import java.util.Collection;
import java.util.List;

/**
 * A visited node whose listings haven't all been fetched yet.
 *
 * @param directions listings still to fetch, the first of them partially
 * @param cursor     where the first listing continues, null to start it from the beginning
 * @param fetched    edges already taken from the first listing
 */
public record NodeProgress(FrontierNode node, List<Direction> directions, @Nullable String cursor, int fetched) {
    public NodeProgress {
        directions = List.copyOf(directions);
    }

    static NodeProgress start(FrontierNode node, Collection<Direction> directions) {
        return new NodeProgress(node, List.copyOf(directions), null, 0);
    }
}
