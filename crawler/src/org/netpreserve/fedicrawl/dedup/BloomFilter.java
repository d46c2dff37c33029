package org.netpreserve.fedicrawl.dedup;

import java.nio.ByteBuffer;
import java.util.BitSet;

/**
 * Bloom filter over SHA-256 digests. Bit positions come from double hashing of the digest's first two 64-bit words,
 * so a filter can be rebuilt from stored digests without the original keys. Bits are only ever set.
 */
public class BloomFilter {
    private final FilterParameters parameters;
    private final BitSet bits;

    public BloomFilter(FilterParameters parameters) {
        this(parameters, new BitSet(parameters.size()));
    }

    private BloomFilter(FilterParameters parameters, BitSet bits) {
        this.parameters = parameters;
        this.bits = bits;
    }

    public static BloomFilter fromBytes(FilterParameters parameters, byte[] bytes) {
        BitSet bits = BitSet.valueOf(bytes);
        if (bits.length() > parameters.size()) {
            throw new IllegalArgumentException("Serialized filter has bits beyond its size " + parameters.size());
        }
        return new BloomFilter(parameters, bits);
    }

    public synchronized void add(byte[] digest) {
        long h1 = word(digest, 0);
        long h2 = word(digest, 8);
        for (int i = 0; i < parameters.hashCount(); i++) {
            bits.set(index(h1, h2, i));
        }
    }

    public synchronized boolean mightContain(byte[] digest) {
        long h1 = word(digest, 0);
        long h2 = word(digest, 8);
        for (int i = 0; i < parameters.hashCount(); i++) {
            if (!bits.get(index(h1, h2, i))) return false;
        }
        return true;
    }

    /**
     * ORs another filter of the same dimensions into this one.
     */
    public synchronized void merge(BloomFilter other) {
        if (!parameters.equals(other.parameters)) {
            throw new IllegalArgumentException("Can't merge filters of different dimensions");
        }
        BitSet otherBits;
        synchronized (other) {
            otherBits = (BitSet) other.bits.clone();
        }
        bits.or(otherBits);
    }

    public synchronized BloomFilter copy() {
        return new BloomFilter(parameters, (BitSet) bits.clone());
    }

    public synchronized byte[] toBytes() {
        return bits.toByteArray();
    }

    public synchronized int cardinality() {
        return bits.cardinality();
    }

    /**
     * Probability that an absent element tests positive at the current fill level.
     */
    public synchronized double estimatedFalsePositiveRate() {
        return Math.pow((double) bits.cardinality() / parameters.size(), parameters.hashCount());
    }

    public FilterParameters parameters() {
        return parameters;
    }

    private int index(long h1, long h2, int i) {
        return (int) Math.floorMod(h1 + i * h2, (long) parameters.size());
    }

    private static long word(byte[] digest, int offset) {
        if (digest.length < offset + 8) throw new IllegalArgumentException("digest too short");
        return ByteBuffer.wrap(digest, offset, 8).getLong();
    }
}
