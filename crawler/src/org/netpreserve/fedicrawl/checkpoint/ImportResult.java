package org.netpreserve.fedicrawl.checkpoint;

/**
 * @param imported   checkpoints written
 * @param skipped    checkpoints whose id was already present
 * @param renumbered imported checkpoints whose sequence was taken locally and were given the next free one
 */
public record ImportResult(int imported, int skipped, int renumbered) {
}
