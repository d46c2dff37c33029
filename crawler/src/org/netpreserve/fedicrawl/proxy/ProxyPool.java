package org.netpreserve.fedicrawl.proxy;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.config.ConfigurationException;
import org.netpreserve.fedicrawl.config.ProxyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Tracks the health of the egress proxies and hands out random healthy ones.
 * <p>
 * All state lives in the shared store, so several crawl processes see the same pool. A rate limited proxy becomes
 * eligible again once its cooldown has passed; this is checked lazily by {@link #acquire()} rather than by a timer.
 * Removing a proxy deletes its row, so nothing can re-admit it afterwards.
 */
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);
    private final ProxyDAO dao;
    private final ProxyProbe probe;
    private final int failureThreshold;
    private final Duration defaultCooldown;
    private final Clock clock;
    private final Random random;

    public ProxyPool(ProxyDAO dao, ProxyProbe probe, ProxyConfig config) {
        this(dao, probe, config, Clock.systemUTC(), new Random());
    }

    public ProxyPool(ProxyDAO dao, ProxyProbe probe, ProxyConfig config, Clock clock, Random random) {
        this.dao = dao;
        this.probe = probe;
        this.failureThreshold = config.failureThreshold();
        this.defaultCooldown = config.rateLimitCooldown();
        this.clock = clock;
        this.random = random;
    }

    /**
     * Registers proxy entries. Malformed entries are reported in the result and don't stop the rest of the batch.
     */
    public RegistrationResult register(Collection<String> entries) {
        var added = new ArrayList<ProxyUri>();
        var existing = new ArrayList<ProxyUri>();
        var rejected = new LinkedHashMap<String, String>();
        Instant now = clock.instant();
        for (String entry : entries) {
            ProxyUri uri;
            try {
                uri = ProxyUri.parse(entry);
            } catch (ConfigurationException e) {
                log.warn("Rejected proxy {}: {}", ProxyUri.mask(String.valueOf(entry)), e.getMessage());
                rejected.put(ProxyUri.mask(String.valueOf(entry)), e.getMessage());
                continue;
            }
            if (dao.insert(uri, now)) {
                added.add(uri);
            } else {
                existing.add(uri);
            }
        }
        log.atInfo().addKeyValue("added", added.size())
                .addKeyValue("existing", existing.size())
                .addKeyValue("rejected", rejected.size())
                .log("Registered proxies");
        return new RegistrationResult(added, existing, rejected);
    }

    /**
     * Picks a uniformly random healthy proxy.
     *
     * @return the proxy, or null if none is healthy and the caller should go direct
     */
    @Nullable
    public ProxyRecord acquire() {
        Instant now = clock.instant();
        int promoted = dao.promoteExpiredCooldowns(now);
        if (promoted > 0) log.debug("{} proxies finished their rate limit cooldown", promoted);
        List<ProxyRecord> healthy = dao.listByStatus(ProxyStatus.HEALTHY);
        if (healthy.isEmpty()) return null;
        ProxyRecord proxy = healthy.get(random.nextInt(healthy.size()));
        dao.touch(proxy.uri(), now);
        return proxy;
    }

    public void reportSuccess(ProxyUri proxy, Duration responseTime) {
        if (!dao.recordSuccess(proxy, responseTime.toMillis())) {
            log.debug("Ignoring success of unregistered proxy {}", proxy.masked());
        }
    }

    public void reportFailure(ProxyUri proxy, String reason) {
        if (!dao.recordFailure(proxy, reason, failureThreshold)) {
            log.debug("Ignoring failure of unregistered proxy {}", proxy.masked());
            return;
        }
        log.atDebug().addKeyValue("proxy", proxy.masked()).addKeyValue("reason", reason).log("Proxy failure");
    }

    /**
     * Puts a proxy into cooldown after the upstream rate limited it.
     *
     * @param cooldown how long to rest the proxy, or null for the configured default
     */
    public void reportRateLimited(ProxyUri proxy, @Nullable Duration cooldown) {
        Duration effective = cooldown == null ? defaultCooldown : cooldown;
        if (dao.recordRateLimited(proxy, clock.instant().plus(effective))) {
            log.atInfo().addKeyValue("proxy", proxy.masked()).addKeyValue("cooldown", effective)
                    .log("Proxy rate limited");
        }
    }

    /**
     * Removes proxies from the pool.
     *
     * @return the number of proxies removed
     */
    public int remove(Collection<String> entries) {
        int removed = 0;
        for (String entry : entries) {
            try {
                if (dao.delete(ProxyUri.parse(entry))) removed++;
            } catch (ConfigurationException e) {
                log.warn("Can't remove proxy {}: {}", ProxyUri.mask(entry), e.getMessage());
            }
        }
        return removed;
    }

    /**
     * Probes every registered proxy, treating each outcome like a reported success or failure.
     *
     * @return the number of proxies that passed
     */
    public int healthCheck() throws InterruptedException {
        int passed = 0;
        List<ProxyRecord> proxies = dao.list();
        for (ProxyRecord proxy : proxies) {
            try {
                reportSuccess(proxy.uri(), probe.probe(proxy.uri()));
                passed++;
            } catch (IOException e) {
                reportFailure(proxy.uri(), "health check: " + e);
            }
        }
        log.atInfo().addKeyValue("passed", passed).addKeyValue("total", proxies.size()).log("Proxy health check");
        return passed;
    }

    public ProxyStats stats() {
        int healthy = 0, unhealthy = 0, rateLimited = 0;
        long requests = 0, successes = 0, failures = 0;
        List<ProxyRecord> proxies = dao.list();
        for (ProxyRecord proxy : proxies) {
            switch (proxy.status()) {
                case HEALTHY -> healthy++;
                case UNHEALTHY -> unhealthy++;
                case RATE_LIMITED -> rateLimited++;
            }
            requests += proxy.requests();
            successes += proxy.successes();
            failures += proxy.failures();
        }
        return new ProxyStats(proxies.size(), healthy, unhealthy, rateLimited, requests, successes, failures);
    }

    public List<ProxyRecord> list() {
        return dao.list();
    }

    public List<ProxyRecord> list(ProxyStatus status) {
        return dao.listByStatus(status);
    }

    @Nullable
    public ProxyRecord find(ProxyUri proxy) {
        return dao.find(proxy);
    }

    /**
     * Marks every proxy healthy again and zeroes its counters.
     */
    public void resetStats() {
        int count = dao.resetAll();
        log.info("Reset {} proxies", count);
    }
}
