package com.team.avagen.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when the perform part of a statement uses actions outside the supported action vocabulary.
 */
@Getter
public class UnsupportedActionException extends StatementConversionException {

    private final List<String> actions;

    public UnsupportedActionException(List<String> actions) {
        super("Unsupported Espresso action(s): " + String.join(", ", actions));
        this.actions = List.copyOf(actions);
    }
}
