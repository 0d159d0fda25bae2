package com.team.avagen.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when the matcher part of a statement uses names outside the supported matcher vocabulary.
 */
@Getter
public class UnsupportedMatcherException extends StatementConversionException {

    private final List<String> matchers;

    public UnsupportedMatcherException(List<String> matchers) {
        super("Unsupported Espresso matcher(s): " + String.join(", ", matchers));
        this.matchers = List.copyOf(matchers);
    }
}
