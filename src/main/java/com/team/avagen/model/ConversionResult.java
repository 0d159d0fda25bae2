package com.team.avagen.model;

/**
 * Outcome of rewriting one statement into the internal form.
 * A {@link Status#FORMAT_ERROR} result carries the sentinel error text instead of a statement.
 */
public record ConversionResult(Status status, String statement) {

    public static final String ERROR_PREFIX = "Error: ";

    public static ConversionResult converted(String statement) {
        return new ConversionResult(Status.CONVERTED, statement);
    }

    public static ConversionResult formatError(String original) {
        return new ConversionResult(Status.FORMAT_ERROR, ERROR_PREFIX + "Invalid Espresso input format: " + original);
    }

    public boolean isConverted() {
        return status == Status.CONVERTED;
    }

    public enum Status {
        CONVERTED,
        FORMAT_ERROR
    }
}
