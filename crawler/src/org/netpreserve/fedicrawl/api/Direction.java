package org.netpreserve.fedicrawl.api;

/**
 * Which side of the follow relation an edge listing enumerates.
 */
public enum Direction {
    /**
     * Accounts following the subject.
     */
    FOLLOWERS(Endpoint.GET_FOLLOWERS),
    /**
     * Accounts the subject follows.
     */
    FOLLOWS(Endpoint.GET_FOLLOWS);

    private final Endpoint endpoint;

    Direction(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    public Endpoint endpoint() {
        return endpoint;
    }
}
