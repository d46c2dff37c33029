package org.netpreserve.fedicrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.fedicrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * Retry of failed upstream calls.
 *
 * @param maxAttempts total attempts per call including the first
 * @param baseDelay   delay before the second attempt
 * @param maxDelay    upper bound on any single delay
 * @param factor      exponential backoff multiplier
 */
public record RetryConfig(
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration baseDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxDelay,
        double factor
) {
    public RetryConfig {
        Checks.validate("retry.maxAttempts", maxAttempts, n -> n >= 1);
        Checks.validate("retry.baseDelay", baseDelay, d -> !d.isNegative());
        Checks.validate("retry.maxDelay", maxDelay, d -> d.compareTo(baseDelay) >= 0);
        Checks.validate("retry.factor", factor, f -> f >= 1.0);
    }
}
