package com.team.avagen.dsl;

import com.team.avagen.exception.ConversionFormatException;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes one normalized Espresso statement. Understands the subset of Java and Kotlin
 * lexical rules that appear in fluent matcher/action chains: identifiers (Kotlin backtick
 * names included), numbers, string and char literals, punctuation. Anything else becomes
 * a single-character {@link TokenType#OPERATOR} token.
 */
public class FluentCallLexer {

    private final String source;
    private int pos;

    public FluentCallLexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char ch = source.charAt(pos);

        if (Character.isJavaIdentifierStart(ch)) {
            while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return token(TokenType.IDENT, start);
        }
        if (ch == '`') {
            int close = source.indexOf('`', pos + 1);
            if (close < 0) {
                throw new ConversionFormatException(source, "unterminated backtick identifier at " + start);
            }
            pos = close + 1;
            return new Token(TokenType.IDENT, source.substring(start + 1, close), start, pos);
        }
        if (Character.isDigit(ch)) {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '.' || source.charAt(pos) == '_')) {
                pos++;
            }
            return token(TokenType.NUMBER, start);
        }
        if (ch == '"') {
            readQuoted('"', start);
            return token(TokenType.STRING, start);
        }
        if (ch == '\'') {
            readQuoted('\'', start);
            return token(TokenType.CHAR, start);
        }

        pos++;
        return switch (ch) {
            case '.' -> token(TokenType.DOT, start);
            case ',' -> token(TokenType.COMMA, start);
            case '(' -> token(TokenType.LPAREN, start);
            case ')' -> token(TokenType.RPAREN, start);
            case ';' -> token(TokenType.SEMICOLON, start);
            default -> token(TokenType.OPERATOR, start);
        };
    }

    private void readQuoted(char quote, int start) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            pos++;
            if (c == quote) {
                return;
            }
        }
        throw new ConversionFormatException(source, "unterminated literal at " + start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token token(TokenType type, int start) {
        return new Token(type, source.substring(start, pos), start, pos);
    }
}
