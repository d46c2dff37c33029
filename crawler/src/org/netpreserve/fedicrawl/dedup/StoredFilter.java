package org.netpreserve.fedicrawl.dedup;

import java.time.Instant;

public record StoredFilter(Namespace namespace, int size, int hashCount, byte[] bits, Instant saved) {
    FilterParameters parameters() {
        return new FilterParameters(size, hashCount);
    }
}
