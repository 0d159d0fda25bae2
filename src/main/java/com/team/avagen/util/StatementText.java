package com.team.avagen.util;

import java.util.regex.Pattern;

/**
 * Whitespace normalization for single-line statements. String literal contents are left untouched.
 */
public final class StatementText {

    private static final Pattern PERFORM_CHAIN = Pattern.compile("\\)\\s*\\.perform\\s*\\(");

    private StatementText() {
    }

    /**
     * Collapse whitespace runs to one space outside string literals and trim.
     */
    public static String collapseWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        boolean pendingSpace = false;

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                sb.append(ch);
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }
            if (Character.isWhitespace(ch)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            if (ch == '"') inString = true;
            sb.append(ch);
        }
        return sb.toString();
    }

    /**
     * Tighten spacing around parentheses, commas and semicolons, outside string literals.
     * {@code "f( a ,b )  ;"} becomes {@code "f(a, b);"}.
     */
    public static String tighten(String text) {
        String collapsed = collapseWhitespace(text);
        StringBuilder sb = new StringBuilder(collapsed.length());
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < collapsed.length(); i++) {
            char ch = collapsed.charAt(i);
            if (inString) {
                sb.append(ch);
                if (escaped) escaped = false;
                else if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }
            if (ch == ' ') {
                char prev = sb.length() > 0 ? sb.charAt(sb.length() - 1) : '\0';
                char next = i + 1 < collapsed.length() ? collapsed.charAt(i + 1) : '\0';
                if (prev == '(' || next == ')' || next == ';' || next == ',') {
                    continue;
                }
            }
            if (ch == '"') inString = true;
            sb.append(ch);
            if (ch == ',' && i + 1 < collapsed.length() && collapsed.charAt(i + 1) != ' ') {
                sb.append(' ');
            }
        }
        return sb.toString();
    }

    /**
     * Join collected lines into one statement ending with {@code ;} and with {@code ).perform(} tightened.
     */
    public static String joinStatement(Iterable<String> lines) {
        String joined = collapseWhitespace(String.join(" ", lines));
        joined = PERFORM_CHAIN.matcher(joined).replaceAll(").perform(");
        if (!joined.endsWith(";")) {
            joined = joined + ";";
        }
        return joined;
    }
}
