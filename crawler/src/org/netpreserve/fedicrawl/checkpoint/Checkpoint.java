package org.netpreserve.fedicrawl.checkpoint;

import java.time.Instant;

/**
 * An immutable snapshot of crawl progress. The state is opaque to the store; it belongs to whichever crawler
 * wrote it.
 *
 * @param sequence strictly increasing per scraper type
 */
public record Checkpoint(String id, String scraperType, String sessionId, long sequence, Instant timestamp,
                         byte[] state, CheckpointMetadata metadata) {
    public String status() {
        return metadata.get(CheckpointMetadata.STATUS);
    }
}
