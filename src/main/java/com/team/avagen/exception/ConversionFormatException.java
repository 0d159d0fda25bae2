package com.team.avagen.exception;

import lombok.Getter;

/**
 * Thrown when a statement is not shaped {@code entry(...).perform(...);}.
 */
@Getter
public class ConversionFormatException extends StatementConversionException {

    private final String statement;

    public ConversionFormatException(String statement, String details) {
        super("Invalid Espresso format (" + details + "): " + statement);
        this.statement = statement;
    }
}
