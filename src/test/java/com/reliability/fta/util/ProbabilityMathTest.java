package com.reliability.fta.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class ProbabilityMathTest {

    @Test
    public void testRoundingUsesSixDigits() {
        assertEquals(0.123457, ProbabilityMath.round(0.1234567), 0.0);
        assertEquals(0.3, ProbabilityMath.round(0.1 + 0.2), 0.0);
        assertEquals(0.36, ProbabilityMath.round(0.4 * 0.9), 0.0);
    }

    @Test
    public void testNonFiniteValuesPassThrough() {
        assertTrue(Double.isNaN(ProbabilityMath.round(Double.NaN)));
        assertEquals(Double.POSITIVE_INFINITY, ProbabilityMath.round(Double.POSITIVE_INFINITY), 0.0);
    }

    @Test
    public void testProductAndUnionHonorCount() {
        double[] values = { 0.5, 0.4, 0.9 };
        assertEquals(0.2, ProbabilityMath.product(values, 2), 1e-12);
        assertEquals(0.7, ProbabilityMath.union(values, 2), 1e-12);

        // Empty product is the neutral element; empty union is impossible
        assertEquals(1.0, ProbabilityMath.product(values, 0), 0.0);
        assertEquals(0.0, ProbabilityMath.union(values, 0), 0.0);
    }

    @Test
    public void testUnionWithLeadingValue() {
        double[] rest = { 0.3 };
        assertEquals(0.44, ProbabilityMath.union(0.2, rest, 1), 1e-12);
        assertEquals(0.2, ProbabilityMath.union(0.2, rest, 0), 1e-12);
    }
}
