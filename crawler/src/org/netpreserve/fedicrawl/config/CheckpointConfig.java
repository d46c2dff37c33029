package org.netpreserve.fedicrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.util.DurationDeserializer;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Checkpointing of crawl progress.
 *
 * @param enabled   write checkpoints at all
 * @param frequency retention basis: the newest {@code frequency * 2} checkpoints are kept
 * @param interval  number of processed nodes between periodic checkpoints
 * @param maxAge    checkpoints older than this are not resumed from
 * @param backup    also write each checkpoint as a JSON file to {@code backupDir}
 * @param backupDir directory for backup files
 */
public record CheckpointConfig(
        boolean enabled,
        int frequency,
        int interval,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxAge,
        boolean backup,
        @Nullable Path backupDir
) {
    public CheckpointConfig {
        Checks.validate("checkpoint.frequency", frequency, n -> n >= 1);
        Checks.validate("checkpoint.interval", interval, n -> n >= 1);
        Checks.validate("checkpoint.maxAge", maxAge, d -> !d.isNegative() && !d.isZero());
        if (backup) Checks.validate("checkpoint.backupDir", backupDir, dir -> !dir.toString().isBlank());
    }

    public int retention() {
        return frequency * 2;
    }
}
