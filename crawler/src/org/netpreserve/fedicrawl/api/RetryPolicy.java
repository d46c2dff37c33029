package org.netpreserve.fedicrawl.api;

import org.netpreserve.fedicrawl.config.RetryConfig;

import java.time.Duration;

/**
 * Decides whether a failed call is tried again, independent of how calls are made.
 * <ul>
 *     <li>transient network errors back off exponentially from the base delay, capped at the maximum</li>
 *     <li>a rate limited call goes straight back behind the rate limiter when its proxy is now cooling down,
 *     otherwise it waits out the upstream's Retry-After</li>
 *     <li>client and validation errors are never retried</li>
 * </ul>
 */
public class RetryPolicy {
    private final RetryConfig config;

    public RetryPolicy(RetryConfig config) {
        this.config = config;
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     */
    public RetryDecision decide(int attempt, ApiException error) {
        if (attempt >= config.maxAttempts()) return RetryDecision.GIVE_UP;
        if (error instanceof TransientNetworkException) {
            return RetryDecision.retryAfter(backoff(attempt));
        } else if (error instanceof RateLimitException rateLimit) {
            if (rateLimit.proxied()) return RetryDecision.retryAfter(Duration.ZERO);
            return RetryDecision.retryAfter(min(rateLimit.retryAfter(), config.maxDelay()));
        }
        return RetryDecision.GIVE_UP;
    }

    private Duration backoff(int attempt) {
        double millis = config.baseDelay().toMillis() * Math.pow(config.factor(), attempt - 1);
        if (millis >= config.maxDelay().toMillis()) return config.maxDelay();
        return Duration.ofMillis((long) millis);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
