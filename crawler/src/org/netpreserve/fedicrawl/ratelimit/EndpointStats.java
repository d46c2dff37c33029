package org.netpreserve.fedicrawl.ratelimit;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * @param requests        slots granted
 * @param throttled       slots whose wait exceeded {@link RateLimiter#THROTTLE_THRESHOLD}
 * @param averageWaitTime rolling mean wait of the throttled slots, in milliseconds
 * @param lastRequest     when the most recent slot was granted
 */
public record EndpointStats(String endpoint, long requests, long throttled, double averageWaitTime,
                            @Nullable Instant lastRequest) {
    public double throttleRate() {
        return requests == 0 ? 0.0 : (double) throttled / requests;
    }
}
