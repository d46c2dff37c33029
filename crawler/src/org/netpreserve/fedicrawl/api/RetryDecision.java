package org.netpreserve.fedicrawl.api;

import java.time.Duration;

public record RetryDecision(boolean shouldRetry, Duration delay) {
    public static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
