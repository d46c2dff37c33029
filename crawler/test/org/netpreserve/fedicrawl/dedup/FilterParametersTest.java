package org.netpreserve.fedicrawl.dedup;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterParametersTest {
    @Test
    void derivesStandardOptimum() {
        var parameters = FilterParameters.derive(1_000_000, 0.01);
        assertEquals(9_585_059, parameters.size());
        assertEquals(7, parameters.hashCount());
    }

    @Test
    void smallestInputsStillGiveUsableFilter() {
        var parameters = FilterParameters.derive(1, 0.99);
        assertTrue(parameters.size() >= 1);
        assertTrue(parameters.hashCount() >= 1);
        for (double p : new double[]{0.5, 0.1, 0.001, 1e-9}) {
            for (long n : new long[]{1, 10, 12345}) {
                var derived = FilterParameters.derive(n, p);
                assertTrue(derived.size() > 0);
                assertTrue(derived.hashCount() >= 1);
            }
        }
    }

    @Test
    void rejectsInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> FilterParameters.derive(0, 0.01));
        assertThrows(IllegalArgumentException.class, () -> FilterParameters.derive(10, 0));
        assertThrows(IllegalArgumentException.class, () -> FilterParameters.derive(10, 1));
        assertThrows(IllegalArgumentException.class, () -> FilterParameters.derive(10_000_000_000L, 0.0001));
    }
}
