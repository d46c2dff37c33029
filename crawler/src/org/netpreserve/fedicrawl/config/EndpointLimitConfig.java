package org.netpreserve.fedicrawl.config;

/**
 * Rate limit override for a single logical endpoint.
 *
 * @param requestsPerMinute sustained request rate
 * @param burstLimit        reservoir capacity
 */
public record EndpointLimitConfig(int requestsPerMinute, int burstLimit) {
    public EndpointLimitConfig {
        Checks.validate("requestsPerMinute", requestsPerMinute, n -> n >= 1 && n <= 60000);
        Checks.validate("burstLimit", burstLimit, n -> n >= 1);
    }
}
