package org.netpreserve.fedicrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.api.ApiClient;
import org.netpreserve.fedicrawl.api.JdkHttpTransport;
import org.netpreserve.fedicrawl.api.Profile;
import org.netpreserve.fedicrawl.api.RetryPolicy;
import org.netpreserve.fedicrawl.checkpoint.CheckpointStore;
import org.netpreserve.fedicrawl.config.ConfigurationException;
import org.netpreserve.fedicrawl.config.CrawlerConfig;
import org.netpreserve.fedicrawl.dedup.Deduplicator;
import org.netpreserve.fedicrawl.frontier.CrawlResult;
import org.netpreserve.fedicrawl.frontier.FrontierCrawler;
import org.netpreserve.fedicrawl.frontier.JsonLinesSink;
import org.netpreserve.fedicrawl.frontier.SeedLoader;
import org.netpreserve.fedicrawl.proxy.HttpProxyProbe;
import org.netpreserve.fedicrawl.proxy.ProxyHttpClients;
import org.netpreserve.fedicrawl.proxy.ProxyPool;
import org.netpreserve.fedicrawl.ratelimit.RateLimiter;
import org.netpreserve.fedicrawl.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One crawler process: the shared store and every component built on it, wired from a {@link CrawlerConfig}.
 */
public class Crawl implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Crawl.class);
    private final CrawlerConfig config;
    private final Database db;
    private final ProxyHttpClients httpClients;
    private final ProxyPool proxyPool;
    private final RateLimiter rateLimiter;
    private final ApiClient apiClient;
    private final Deduplicator deduplicator;
    @Nullable
    private final CheckpointStore checkpoints;
    private final ScheduledExecutorService scheduler;
    private final Lock startStopLock = new ReentrantLock();
    private volatile State state = State.STOPPED;
    private volatile FrontierCrawler crawler;
    @Nullable
    private ScheduledFuture<?> healthChecks;

    public enum State {
        STOPPED, STARTING, RUNNING, STOPPING
    }

    public Crawl(CrawlerConfig config) {
        this(config, Database.open(config.store().jdbcUrl()));
    }

    Crawl(CrawlerConfig config, Database db) {
        this.config = config;
        this.db = db;
        this.httpClients = new ProxyHttpClients(config.api().timeout());
        var probe = new HttpProxyProbe(httpClients, URI.create(config.proxies().probeUrl()),
                config.proxies().probeTimeout(), config.api().userAgent());
        this.proxyPool = new ProxyPool(db.proxies(), probe, config.proxies());
        this.rateLimiter = new RateLimiter(config.rateLimits());
        var transport = new JdkHttpTransport(httpClients, config.api().userAgent(), config.api().timeout());
        this.apiClient = new ApiClient(config.api(), transport, rateLimiter, proxyPool, new RetryPolicy(config.retry()));
        this.deduplicator = new Deduplicator(db.dedup(), config.dedup());
        this.checkpoints = config.checkpoint().enabled() ? new CheckpointStore(db.checkpoints(), config.checkpoint()) : null;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("proxy-health"));
    }

    /**
     * Runs a crawl to completion, cancellation or budget exhaustion on the calling thread.
     *
     * @param resume    continue from the latest unfinished checkpoint if there is one
     * @param seedQuery actor search to seed from instead of the configured seeds, or null
     */
    public CrawlResult run(boolean resume, @Nullable String seedQuery)
            throws BadStateException, IOException, InterruptedException {
        FrontierCrawler crawler;
        JsonLinesSink sink;
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            if (state != State.STOPPED) throw new BadStateException("Can only start a STOPPED crawl");
            state = State.STARTING;
            if (!config.proxies().uris().isEmpty()) {
                proxyPool.register(config.proxies().uris());
            }
            healthChecks = scheduleHealthChecks();
            sink = new JsonLinesSink(config.output().directory(), config.output().batchSize());
            crawler = new FrontierCrawler(apiClient, deduplicator, checkpoints, sink, config.traversal(),
                    config.api().pageSize(), config.checkpoint().interval(), Clock.systemUTC());
            this.crawler = crawler;
            state = State.RUNNING;
        } catch (Throwable e) {
            stopHealthChecks();
            state = State.STOPPED;
            throw e;
        } finally {
            startStopLock.unlock();
        }

        try (sink) {
            List<Profile> seeds = resume && crawler.canResume() ? List.of() : loadSeeds(seedQuery);
            return crawler.run(seeds, resume);
        } finally {
            stopHealthChecks();
            this.crawler = null;
            state = State.STOPPED;
        }
    }

    private List<Profile> loadSeeds(@Nullable String seedQuery) throws IOException, InterruptedException {
        var seedLoader = new SeedLoader(apiClient, config.traversal());
        if (seedQuery != null) {
            return seedLoader.fromSearch(seedQuery);
        } else if (config.traversal().seedsFile() != null) {
            return seedLoader.fromDiscoveryFile(config.traversal().seedsFile());
        } else if (!config.seeds().isEmpty()) {
            return seedLoader.fromIdentifiers(config.seeds());
        }
        throw new ConfigurationException("No seeds configured");
    }

    @Nullable
    private ScheduledFuture<?> scheduleHealthChecks() {
        long interval = config.proxies().healthCheckInterval().toMillis();
        if (interval <= 0) return null;
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                proxyPool.healthCheck();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Proxy health check failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHealthChecks() {
        ScheduledFuture<?> healthChecks = this.healthChecks;
        if (healthChecks != null) {
            healthChecks.cancel(false);
            this.healthChecks = null;
        }
    }

    boolean healthChecksScheduled() {
        ScheduledFuture<?> healthChecks = this.healthChecks;
        return healthChecks != null && !healthChecks.isDone();
    }

    /**
     * Asks a running crawl to stop. It checkpoints before {@link #run} returns.
     */
    public void cancel() {
        FrontierCrawler crawler = this.crawler;
        if (crawler != null) {
            state = State.STOPPING;
            crawler.cancel();
        }
    }

    @Override
    public void close() {
        startStopLock.lock();
        try {
            scheduler.shutdownNow();
            try {
                db.close();
            } catch (Exception e) {
                log.error("Failed to close database", e);
            }
        } finally {
            startStopLock.unlock();
        }
    }

    public CrawlerConfig config() {
        return config;
    }

    public State state() {
        return state;
    }

    public ProxyPool proxyPool() {
        return proxyPool;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public Deduplicator deduplicator() {
        return deduplicator;
    }

    /**
     * @throws ConfigurationException if checkpointing is disabled
     */
    public CheckpointStore checkpoints() {
        if (checkpoints == null) throw new ConfigurationException("Checkpointing is disabled");
        return checkpoints;
    }

    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
