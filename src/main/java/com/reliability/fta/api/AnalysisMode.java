package com.reliability.fta.api;

import java.util.Locale;

/**
 * Propagation semantics used by a recalculation pass.
 */
public enum AnalysisMode {
    /** Fault Tree Analysis: bottom-up, gates and links. */
    FTA,
    /** Event Tree Analysis: top-down cumulative product along the ancestor chain. */
    ETA;

    /**
     * Parses a mode string. Missing or blank values mean {@link #FTA}.
     *
     * @throws TreeValidationException for unknown values.
     */
    public static AnalysisMode fromString(String raw) {
        if (raw == null || raw.isBlank())
            return FTA;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "FTA" -> FTA;
            case "ETA" -> ETA;
            default -> throw new TreeValidationException("Unknown analysis mode: '" + raw + "'");
        };
    }
}
