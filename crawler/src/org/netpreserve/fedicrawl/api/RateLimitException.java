package org.netpreserve.fedicrawl.api;

import java.time.Duration;

/**
 * HTTP 429.
 */
public class RateLimitException extends ApiException {
    private final Duration retryAfter;
    private final boolean proxied;

    /**
     * @param retryAfter how long the upstream asked us to back off
     * @param proxied    whether the request went through a proxy, which is now cooling down
     */
    public RateLimitException(String message, Duration retryAfter, boolean proxied) {
        super(message);
        this.retryAfter = retryAfter;
        this.proxied = proxied;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    public boolean proxied() {
        return proxied;
    }
}
