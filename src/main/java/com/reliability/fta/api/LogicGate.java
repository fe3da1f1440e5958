package com.reliability.fta.api;

import java.util.Locale;

/**
 * Combination rule for a node's children (gate) or for a cross-link
 * (relation).
 *
 * In FTA mode an AND gate multiplies the children's probabilities and an OR
 * gate applies the union formula {@code 1 - prod(1 - p)}. The same two values
 * classify links: AND links scale a node's value, OR links are unioned with it.
 */
public enum LogicGate {
    AND,
    OR;

    /**
     * Parses a gate or relation string as it appears in documents and edits.
     * Missing or blank values default to {@link #OR}; matching is
     * case-insensitive.
     *
     * @throws TreeValidationException if the value names neither gate.
     */
    public static LogicGate fromString(String raw) {
        if (raw == null || raw.isBlank())
            return OR;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> AND;
            case "OR" -> OR;
            default -> throw new TreeValidationException("Unknown logic gate or relation: '" + raw + "'");
        };
    }
}
