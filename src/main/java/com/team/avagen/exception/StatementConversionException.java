package com.team.avagen.exception;

/**
 * Base class for failures raised while validating or converting a single
 * Espresso statement. Callers that process a whole method catch this type
 * and drop only the offending statement.
 */
public abstract class StatementConversionException extends RuntimeException {

    protected StatementConversionException(String message) {
        super(message);
    }
}
