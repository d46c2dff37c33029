package org.netpreserve.fedicrawl.proxy;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Health and usage of one registered proxy, as last seen in the store.
 */
public record ProxyRecord(
        ProxyUri uri,
        ProxyStatus status,
        int consecutiveFailures,
        long requests,
        long successes,
        long failures,
        long totalResponseTime,
        @Nullable String lastFailureReason,
        @Nullable Instant cooldownUntil,
        @Nullable Instant lastUsed,
        Instant added) {

    public Duration averageResponseTime() {
        return successes == 0 ? Duration.ZERO : Duration.ofMillis(totalResponseTime / successes);
    }

    public double successRate() {
        return requests == 0 ? 0.0 : (double) successes / requests;
    }
}
