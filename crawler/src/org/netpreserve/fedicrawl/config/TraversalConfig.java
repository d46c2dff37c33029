package org.netpreserve.fedicrawl.config;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.api.Direction;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Shape and budget of the breadth-first traversal.
 *
 * @param maxDepth            deepest level whose nodes are fetched (1-5)
 * @param maxNodes            stop after this many nodes have been processed (null for no limit)
 * @param maxEdges            stop after this many edges have been emitted (null for no limit)
 * @param maxFollowersPerNode cap on follower entries fetched per node
 * @param maxFollowsPerNode   cap on following entries fetched per node
 * @param minFollowerCount    nodes with fewer known followers are not enqueued
 * @param prioritizePopular   sort seeds and each batch of newly admitted nodes by follower count, descending
 * @param directions          edge listings to traverse
 * @param maxSeeds            cap on the number of seeds
 * @param seedsFile           JSON lines file of profiles from an earlier run to seed from
 */
public record TraversalConfig(
        int maxDepth,
        @Nullable Long maxNodes,
        @Nullable Long maxEdges,
        int maxFollowersPerNode,
        int maxFollowsPerNode,
        long minFollowerCount,
        boolean prioritizePopular,
        Set<Direction> directions,
        int maxSeeds,
        @Nullable Path seedsFile
) {
    public TraversalConfig {
        Checks.validate("traversal.maxDepth", maxDepth, d -> d >= 1 && d <= 5);
        Checks.validateIfNotNull("traversal.maxNodes", maxNodes, n -> n > 0);
        Checks.validateIfNotNull("traversal.maxEdges", maxEdges, n -> n > 0);
        Checks.validate("traversal.maxFollowersPerNode", maxFollowersPerNode, n -> n >= 0);
        Checks.validate("traversal.maxFollowsPerNode", maxFollowsPerNode, n -> n >= 0);
        Checks.validate("traversal.minFollowerCount", minFollowerCount, n -> n >= 0);
        Checks.validate("traversal.directions", directions, d -> !d.isEmpty());
        Checks.validate("traversal.maxSeeds", maxSeeds, n -> n >= 1);
        directions = Collections.unmodifiableSet(EnumSet.copyOf(directions));
    }

    public int maxEdgesPerNode(Direction direction) {
        return direction == Direction.FOLLOWERS ? maxFollowersPerNode : maxFollowsPerNode;
    }
}
