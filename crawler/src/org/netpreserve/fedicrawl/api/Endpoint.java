package org.netpreserve.fedicrawl.api;

/**
 * Upstream XRPC methods. The key doubles as the rate limiter's endpoint name.
 */
public enum Endpoint {
    GET_PROFILE("getProfile", "/xrpc/app.bsky.actor.getProfile"),
    GET_FOLLOWERS("getFollowers", "/xrpc/app.bsky.graph.getFollowers"),
    GET_FOLLOWS("getFollows", "/xrpc/app.bsky.graph.getFollows"),
    SEARCH_ACTORS("searchActors", "/xrpc/app.bsky.actor.searchActors");

    private final String key;
    private final String path;

    Endpoint(String key, String path) {
        this.key = key;
        this.path = path;
    }

    public String key() {
        return key;
    }

    public String path() {
        return path;
    }
}
