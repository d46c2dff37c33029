package org.netpreserve.fedicrawl.api;

import org.jetbrains.annotations.Nullable;

/**
 * Read access to the follow graph.
 */
public interface GraphSource {
    Profile getProfile(String actor) throws ApiException, InterruptedException;

    /**
     * Lists one page of the accounts following ({@link Direction#FOLLOWERS}) or followed by
     * ({@link Direction#FOLLOWS}) an actor.
     *
     * @param cursor cursor from the previous page, null for the first
     */
    EdgePage listEdges(String actor, Direction direction, @Nullable String cursor, int limit)
            throws ApiException, InterruptedException;

    SearchPage searchActors(String query, @Nullable String cursor, int limit) throws ApiException, InterruptedException;
}
