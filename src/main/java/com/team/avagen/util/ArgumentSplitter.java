package com.team.avagen.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits argument lists on top-level commas and measures parenthesis balance,
 * ignoring anything inside double-quoted string literals.
 */
@Component
public class ArgumentSplitter {

    private enum State {
        OUTSIDE,
        IN_STRING,
        IN_STRING_ESCAPED
    }

    /**
     * Split {@code a, f(b, c), "d,e"} into {@code [a, f(b, c), "d,e"]}.
     * Parts are trimmed; a trailing empty part is not returned.
     */
    public List<String> split(String args) {
        List<String> parts = new ArrayList<>();
        if (args == null) return parts;

        StringBuilder current = new StringBuilder();
        State state = State.OUTSIDE;
        int depth = 0;

        for (int i = 0; i < args.length(); i++) {
            char ch = args.charAt(i);
            switch (state) {
                case IN_STRING_ESCAPED -> {
                    current.append(ch);
                    state = State.IN_STRING;
                }
                case IN_STRING -> {
                    current.append(ch);
                    if (ch == '\\') {
                        state = State.IN_STRING_ESCAPED;
                    } else if (ch == '"') {
                        state = State.OUTSIDE;
                    }
                }
                case OUTSIDE -> {
                    if (ch == ',' && depth == 0) {
                        parts.add(current.toString().trim());
                        current.setLength(0);
                        continue;
                    }
                    if (ch == '"') {
                        state = State.IN_STRING;
                    } else if (ch == '(') {
                        depth++;
                    } else if (ch == ')') {
                        depth--;
                    }
                    current.append(ch);
                }
            }
        }

        String last = current.toString().trim();
        if (!last.isEmpty()) {
            parts.add(last);
        }
        return parts;
    }

    /**
     * Count of {@code open} minus count of {@code close} outside string literals.
     */
    public static int balance(String text, char open, char close) {
        State state = State.OUTSIDE;
        int balance = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (state) {
                case IN_STRING_ESCAPED -> state = State.IN_STRING;
                case IN_STRING -> {
                    if (ch == '\\') state = State.IN_STRING_ESCAPED;
                    else if (ch == '"') state = State.OUTSIDE;
                }
                case OUTSIDE -> {
                    if (ch == '"') state = State.IN_STRING;
                    else if (ch == open) balance++;
                    else if (ch == close) balance--;
                }
            }
        }
        return balance;
    }

    public static int parenBalance(String text) {
        return balance(text, '(', ')');
    }
}
