package org.netpreserve.fedicrawl.ratelimit;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket for one endpoint. Holds up to {@code capacity} tokens and regains one every {@code interval}.
 * <p>
 * A caller that finds the bucket empty still takes a token, driving the level negative, and is told how long to
 * wait for the refill that covers it. Because reservations are handed out under a fair lock, callers are admitted
 * in arrival order and never closer together than the interval.
 */
class RateBucket {
    private final String endpoint;
    private final long capacity;
    private final long intervalMillis;
    private final ReentrantLock lock = new ReentrantLock(true);
    private long tokens;
    private long lastRefill;

    RateBucket(String endpoint, long capacity, Duration interval, long nowMillis) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive");
        if (interval.toMillis() < 1) throw new IllegalArgumentException("interval must be at least 1ms");
        this.endpoint = endpoint;
        this.capacity = capacity;
        this.intervalMillis = interval.toMillis();
        this.tokens = capacity;
        this.lastRefill = nowMillis;
    }

    /**
     * Takes a token.
     *
     * @return how long the caller must wait before using it
     */
    Duration reserve(long nowMillis) {
        lock.lock();
        try {
            refill(nowMillis);
            tokens--;
            if (tokens >= 0) return Duration.ZERO;
            long grantedAt = lastRefill + (-tokens) * intervalMillis;
            return Duration.ofMillis(Math.max(0, grantedAt - nowMillis));
        } finally {
            lock.unlock();
        }
    }

    private void refill(long nowMillis) {
        long gained = (nowMillis - lastRefill) / intervalMillis;
        if (gained <= 0) return;
        tokens += gained;
        lastRefill += gained * intervalMillis;
        if (tokens >= capacity) {
            tokens = capacity;
            lastRefill = nowMillis;
        }
    }

    /**
     * Tokens available right now, zero if callers are already queued for future refills.
     */
    long available(long nowMillis) {
        lock.lock();
        try {
            refill(nowMillis);
            return Math.max(0, tokens);
        } finally {
            lock.unlock();
        }
    }

    String endpoint() {
        return endpoint;
    }

    long capacity() {
        return capacity;
    }

    Duration interval() {
        return Duration.ofMillis(intervalMillis);
    }
}
