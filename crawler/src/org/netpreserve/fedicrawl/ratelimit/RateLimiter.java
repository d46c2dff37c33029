package org.netpreserve.fedicrawl.ratelimit;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.config.EndpointLimitConfig;
import org.netpreserve.fedicrawl.config.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Throttles outbound calls per logical endpoint.
 * <p>
 * Each endpoint gets its own {@link RateBucket}, created on first use and sized from the endpoint's override or
 * the global default. A fair semaphore additionally caps the number of calls in flight across all endpoints.
 * One instance is shared by everything that talks to the upstream.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    public static final Duration THROTTLE_THRESHOLD = Duration.ofMillis(100);
    private static final String GLOBAL = "*";

    private final RateLimitConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;
    private final ConcurrentMap<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    private final Semaphore concurrency;
    private final Counters global = new Counters(GLOBAL);
    private final Lock pauseLock = new ReentrantLock();
    private final Condition resumed = pauseLock.newCondition();
    private boolean paused;

    public RateLimiter(RateLimitConfig config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM, new Random());
    }

    public RateLimiter(RateLimitConfig config, Clock clock, Sleeper sleeper, Random random) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
        this.concurrency = new Semaphore(config.maxConcurrent(), true);
    }

    /**
     * Blocks until the endpoint's bucket admits the caller and a concurrency slot is free. The returned slot must be
     * closed once the call completes.
     */
    public Slot acquireSlot(String endpointName) throws InterruptedException {
        awaitResumed();
        Endpoint endpoint = endpoints.computeIfAbsent(endpointName, this::newEndpoint);
        long start = clock.millis();
        endpoint.queued.incrementAndGet();
        try {
            Duration wait = endpoint.bucket.reserve(start);
            if (!wait.isZero()) sleeper.sleep(wait);
            awaitResumed();
            concurrency.acquire();
        } finally {
            endpoint.queued.decrementAndGet();
        }
        endpoint.running.incrementAndGet();
        long now = clock.millis();
        long waited = now - start;
        endpoint.counters.record(waited, now);
        global.record(waited, now);
        if (waited > THROTTLE_THRESHOLD.toMillis()) {
            log.atDebug().addKeyValue("endpoint", endpointName).addKeyValue("waitMs", waited).log("Throttled");
        }
        return new Slot(endpoint);
    }

    private Endpoint newEndpoint(String name) {
        EndpointLimitConfig limits = config.limitsFor(name);
        long spacing = 60000 / limits.requestsPerMinute();
        if (config.jitter()) {
            spacing += (long) (spacing * 0.2 * random.nextDouble());
        }
        spacing = Math.max(1, Math.max(spacing, config.minInterval().toMillis()));
        log.atDebug().addKeyValue("endpoint", name)
                .addKeyValue("burst", limits.burstLimit())
                .addKeyValue("intervalMs", spacing)
                .log("Created rate bucket");
        return new Endpoint(new RateBucket(name, limits.burstLimit(), Duration.ofMillis(spacing), clock.millis()));
    }

    private void awaitResumed() throws InterruptedException {
        pauseLock.lock();
        try {
            while (paused) {
                resumed.await();
            }
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Holds back every endpoint until {@link #resumeAll()}. Callers already past the gate finish normally.
     */
    public void pauseAll() {
        pauseLock.lock();
        try {
            paused = true;
        } finally {
            pauseLock.unlock();
        }
        log.info("Rate limiter paused");
    }

    public void resumeAll() {
        pauseLock.lock();
        try {
            paused = false;
            resumed.signalAll();
        } finally {
            pauseLock.unlock();
        }
        log.info("Rate limiter resumed");
    }

    public boolean isPaused() {
        pauseLock.lock();
        try {
            return paused;
        } finally {
            pauseLock.unlock();
        }
    }

    @Nullable
    public EndpointStats stats(String endpointName) {
        Endpoint endpoint = endpoints.get(endpointName);
        return endpoint == null ? null : endpoint.counters.snapshot();
    }

    /**
     * Totals over all endpoints, reported under the name {@code *}.
     */
    public EndpointStats globalStats() {
        return global.snapshot();
    }

    public Map<String, EndpointStats> allStats() {
        var stats = new TreeMap<String, EndpointStats>();
        endpoints.forEach((name, endpoint) -> stats.put(name, endpoint.counters.snapshot()));
        return stats;
    }

    @Nullable
    public QueueStatus queueStatus(String endpointName) {
        Endpoint endpoint = endpoints.get(endpointName);
        if (endpoint == null) return null;
        return new QueueStatus(endpointName, endpoint.queued.get(), endpoint.running.get(),
                endpoint.bucket.available(clock.millis()));
    }

    /**
     * The spacing an endpoint's bucket refills at, once it exists.
     */
    @Nullable
    public Duration interval(String endpointName) {
        Endpoint endpoint = endpoints.get(endpointName);
        return endpoint == null ? null : endpoint.bucket.interval();
    }

    public void resetStats() {
        endpoints.values().forEach(endpoint -> endpoint.counters.reset());
        global.reset();
    }

    public class Slot implements AutoCloseable {
        private final Endpoint endpoint;
        private final AtomicBoolean released = new AtomicBoolean();

        private Slot(Endpoint endpoint) {
            this.endpoint = endpoint;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                endpoint.running.decrementAndGet();
                concurrency.release();
            }
        }
    }

    private static class Endpoint {
        final RateBucket bucket;
        final Counters counters;
        final AtomicInteger queued = new AtomicInteger();
        final AtomicInteger running = new AtomicInteger();

        Endpoint(RateBucket bucket) {
            this.bucket = bucket;
            this.counters = new Counters(bucket.endpoint());
        }
    }

    private static class Counters {
        private final String name;
        private long requests;
        private long throttled;
        private double averageWait;
        private long lastRequest = -1;

        Counters(String name) {
            this.name = name;
        }

        synchronized void record(long waitMillis, long nowMillis) {
            requests++;
            lastRequest = nowMillis;
            if (waitMillis > THROTTLE_THRESHOLD.toMillis()) {
                throttled++;
                averageWait += (waitMillis - averageWait) / throttled;
            }
        }

        synchronized void reset() {
            requests = 0;
            throttled = 0;
            averageWait = 0;
            lastRequest = -1;
        }

        synchronized EndpointStats snapshot() {
            return new EndpointStats(name, requests, throttled, averageWait,
                    lastRequest < 0 ? null : Instant.ofEpochMilli(lastRequest));
        }
    }
}
