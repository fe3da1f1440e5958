package com.reliability.fta.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Probability arithmetic shared by the evaluators.
 *
 * Rounding works on the exact binary value of the double, so
 * {@code round(0.1 + 0.2)} yields {@code 0.3} and ties are settled
 * half-to-even.
 */
public final class ProbabilityMath {
    public static final int SCALE = 6;

    private ProbabilityMath() {
        // Utility class
    }

    /** Rounds to {@link #SCALE} decimal digits. Non-finite values pass through. */
    public static double round(double value) {
        if (!Double.isFinite(value))
            return value;
        return new BigDecimal(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** Product of the first {@code count} values; 1.0 when empty. */
    public static double product(double[] values, int count) {
        double result = 1.0;
        for (int i = 0; i < count; i++)
            result *= values[i];
        return result;
    }

    /** Union formula {@code 1 - prod(1 - v)} over the first {@code count} values. */
    public static double union(double[] values, int count) {
        double complement = 1.0;
        for (int i = 0; i < count; i++)
            complement *= 1.0 - values[i];
        return 1.0 - complement;
    }

    /** Union of {@code first} with the first {@code count} values of {@code rest}. */
    public static double union(double first, double[] rest, int count) {
        double complement = 1.0 - first;
        for (int i = 0; i < count; i++)
            complement *= 1.0 - rest[i];
        return 1.0 - complement;
    }
}
