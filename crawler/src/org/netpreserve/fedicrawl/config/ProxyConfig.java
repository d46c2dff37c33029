package org.netpreserve.fedicrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.fedicrawl.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * Egress proxy pool.
 *
 * @param uris                proxies to register at startup, {@code scheme://[user:pass@]host:port} or
 *                            {@code host:port[:user:pass]}
 * @param failureThreshold    consecutive failures after which a healthy proxy becomes unhealthy
 * @param rateLimitCooldown   cooldown applied on a 429 response that carries no Retry-After header
 * @param probeUrl            URL fetched through each proxy by the health check
 * @param probeTimeout        timeout for a single health probe
 * @param healthCheckInterval how often a running crawl health checks the pool (zero disables)
 */
public record ProxyConfig(
        List<String> uris,
        int failureThreshold,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration rateLimitCooldown,
        String probeUrl,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration probeTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration healthCheckInterval
) {
    public ProxyConfig {
        uris = uris == null ? List.of() : List.copyOf(uris);
        Checks.validate("proxies.failureThreshold", failureThreshold, n -> n >= 1);
        Checks.validate("proxies.rateLimitCooldown", rateLimitCooldown, d -> !d.isNegative());
        Checks.validate("proxies.probeUrl", probeUrl, url -> url.startsWith("https://") || url.startsWith("http://"));
        Checks.validate("proxies.probeTimeout", probeTimeout, d -> !d.isNegative() && !d.isZero());
        Checks.validate("proxies.healthCheckInterval", healthCheckInterval, d -> !d.isNegative());
    }
}
