package org.netpreserve.fedicrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.fedicrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * Upstream graph API.
 *
 * @param baseUrl   base URL of the AppView, e.g. https://public.api.bsky.app
 * @param userAgent User-Agent header sent with every request
 * @param timeout   per-request timeout, also used as the connect timeout
 * @param pageSize  number of entries requested per page of a listing (1-100)
 */
public record ApiConfig(
        String baseUrl,
        String userAgent,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        int pageSize
) {
    public ApiConfig {
        Checks.validate("api.baseUrl", baseUrl, url -> url.startsWith("https://") || url.startsWith("http://"));
        Checks.validate("api.userAgent", userAgent, ua -> !ua.isBlank());
        Checks.validate("api.timeout", timeout, t -> !t.isNegative() && !t.isZero());
        Checks.validate("api.pageSize", pageSize, n -> n >= 1 && n <= 100);
        if (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
}
