package com.reliability.fta.api;

/**
 * Hard validation failure raised at the data-entry boundary (construction,
 * load, insert, update). The evaluators never raise it: they assume the tree
 * they walk has already passed these checks.
 */
public class TreeValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public TreeValidationException(String message) {
        super(message);
    }

    public TreeValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
