package org.netpreserve.fedicrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.fedicrawl.util.DurationDeserializer;

import java.time.Duration;
import java.util.Map;

/**
 * Client-side request throttling.
 *
 * @param requestsPerMinute default sustained rate for endpoints without an override
 * @param burstLimit        default reservoir capacity
 * @param maxConcurrent     maximum requests in flight across all endpoints
 * @param minInterval       lower bound for the spacing between refills of any endpoint
 * @param jitter            widen each endpoint's spacing by up to 20%, chosen once per endpoint
 * @param endpoints         per-endpoint overrides keyed by logical endpoint name
 */
public record RateLimitConfig(
        int requestsPerMinute,
        int burstLimit,
        int maxConcurrent,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration minInterval,
        boolean jitter,
        Map<String, EndpointLimitConfig> endpoints
) {
    public RateLimitConfig {
        Checks.validate("rateLimits.requestsPerMinute", requestsPerMinute, n -> n >= 1 && n <= 60000);
        Checks.validate("rateLimits.burstLimit", burstLimit, n -> n >= 1);
        Checks.validate("rateLimits.maxConcurrent", maxConcurrent, n -> n >= 1);
        Checks.validate("rateLimits.minInterval", minInterval, d -> !d.isNegative());
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
    }

    public EndpointLimitConfig limitsFor(String endpoint) {
        return endpoints.getOrDefault(endpoint, new EndpointLimitConfig(requestsPerMinute, burstLimit));
    }
}
