package org.netpreserve.fedicrawl.config;

/**
 * Shared coordination store.
 *
 * @param jdbcUrl JDBC URL of the SQLite database shared by all crawl processes
 */
public record StoreConfig(String jdbcUrl) {
    public StoreConfig {
        Checks.validate("store.jdbcUrl", jdbcUrl, url -> url.startsWith("jdbc:"));
    }
}
