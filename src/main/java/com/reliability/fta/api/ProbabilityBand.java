package com.reliability.fta.api;

/**
 * Threshold classes used by diagram and report collaborators to color-code
 * nodes by calculated probability.
 */
public enum ProbabilityBand {
    /** Exactly 1.0. */
    CERTAIN("pink"),
    /** Exactly 0.0. */
    IMPOSSIBLE("lightblue"),
    /** At least 0.7. */
    HIGH("lightyellow"),
    NORMAL("white"),
    /** No calculation has run yet. */
    UNEVALUATED("white");

    private final String color;

    ProbabilityBand(String color) {
        this.color = color;
    }

    public String color() {
        return color;
    }

    public static ProbabilityBand of(Double calculated) {
        if (calculated == null)
            return UNEVALUATED;
        double p = calculated;
        if (p == 1.0)
            return CERTAIN;
        if (p == 0.0)
            return IMPOSSIBLE;
        if (p >= 0.7)
            return HIGH;
        return NORMAL;
    }
}
