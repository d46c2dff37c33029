package org.netpreserve.fedicrawl.config;

import java.util.List;

/**
 * Root configuration, built once at startup from the bundled defaults merged with the user's file.
 *
 * @param seeds      handles or DIDs to start the traversal from
 * @param store      shared coordination store
 * @param api        upstream graph API
 * @param proxies    egress proxy pool
 * @param rateLimits client-side throttling
 * @param retry      retry of failed upstream calls
 * @param dedup      two-tier deduplication
 * @param checkpoint checkpointing of crawl progress
 * @param traversal  traversal shape and budgets
 * @param output     discovered node and edge output
 */
public record CrawlerConfig(
        List<String> seeds,
        StoreConfig store,
        ApiConfig api,
        ProxyConfig proxies,
        RateLimitConfig rateLimits,
        RetryConfig retry,
        DedupConfig dedup,
        CheckpointConfig checkpoint,
        TraversalConfig traversal,
        OutputConfig output
) {
    public CrawlerConfig {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
        Checks.validate("store", store, s -> true);
        Checks.validate("api", api, s -> true);
        Checks.validate("proxies", proxies, s -> true);
        Checks.validate("rateLimits", rateLimits, s -> true);
        Checks.validate("retry", retry, s -> true);
        Checks.validate("dedup", dedup, s -> true);
        Checks.validate("checkpoint", checkpoint, s -> true);
        Checks.validate("traversal", traversal, s -> true);
        Checks.validate("output", output, s -> true);
    }
}
