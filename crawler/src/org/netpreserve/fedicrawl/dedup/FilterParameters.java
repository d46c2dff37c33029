package org.netpreserve.fedicrawl.dedup;

/**
 * Bloom filter dimensions for an expected element count and target false-positive probability.
 *
 * @param size      number of bits
 * @param hashCount number of bit positions per element
 */
public record FilterParameters(int size, int hashCount) {
    private static final double LN2 = Math.log(2);

    public FilterParameters {
        if (size < 1) throw new IllegalArgumentException("size must be positive");
        if (hashCount < 1) throw new IllegalArgumentException("hashCount must be positive");
    }

    /**
     * Uses the standard optimum: size = ⌈-n·ln(p) / (ln 2)²⌉ and hashCount = max(1, round(size/n · ln 2)).
     */
    public static FilterParameters derive(long expectedElements, double falsePositiveRate) {
        if (expectedElements < 1) throw new IllegalArgumentException("expectedElements must be at least 1");
        if (!(falsePositiveRate > 0 && falsePositiveRate < 1)) {
            throw new IllegalArgumentException("falsePositiveRate must be between 0 and 1 exclusive");
        }
        double bits = Math.ceil(-expectedElements * Math.log(falsePositiveRate) / (LN2 * LN2));
        if (bits > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Filter for " + expectedElements + " elements at p=" +
                                               falsePositiveRate + " needs more than " + Integer.MAX_VALUE + " bits");
        }
        int size = Math.max(1, (int) bits);
        int hashCount = (int) Math.max(1, Math.round((double) size / expectedElements * LN2));
        return new FilterParameters(size, hashCount);
    }
}
