package org.netpreserve.fedicrawl.proxy;

/**
 * Pool-wide counts by status and aggregate request outcomes.
 */
public record ProxyStats(int total, int healthy, int unhealthy, int rateLimited,
                         long requests, long successes, long failures) {
    public double successRate() {
        return requests == 0 ? 0.0 : (double) successes / requests;
    }
}
