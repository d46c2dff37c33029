package org.netpreserve.fedicrawl.config;

import java.nio.file.Path;

/**
 * Discovered node and edge output.
 *
 * @param directory where nodes.jsonl and edges.jsonl are appended
 * @param batchSize number of buffered entries that triggers a write
 */
public record OutputConfig(Path directory, int batchSize) {
    public OutputConfig {
        Checks.validate("output.directory", directory, dir -> !dir.toString().isBlank());
        Checks.validate("output.batchSize", batchSize, n -> n >= 1);
    }
}
