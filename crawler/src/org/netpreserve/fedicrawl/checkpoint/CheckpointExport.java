package org.netpreserve.fedicrawl.checkpoint;

import java.time.Instant;
import java.util.List;

/**
 * File format of {@link CheckpointStore#exportTo}.
 */
public record CheckpointExport(String scraperType, Instant exportTimestamp, int checkpointCount,
                               List<Checkpoint> checkpoints) {
}
