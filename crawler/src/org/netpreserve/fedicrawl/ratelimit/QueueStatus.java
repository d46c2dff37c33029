package org.netpreserve.fedicrawl.ratelimit;

/**
 * @param queued    callers waiting for a token or a concurrency slot
 * @param running   slots currently held
 * @param reservoir tokens immediately available
 */
public record QueueStatus(String endpoint, int queued, int running, long reservoir) {
}
