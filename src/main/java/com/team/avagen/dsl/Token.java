package com.team.avagen.dsl;

/**
 * A lexical token with its half-open source range.
 */
public record Token(TokenType type, String text, int start, int end) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + start;
    }
}
