package com.team.avagen.dsl;

public enum TokenType {
    IDENT,
    NUMBER,
    STRING,
    CHAR,
    DOT,
    COMMA,
    LPAREN,
    RPAREN,
    SEMICOLON,
    OPERATOR,
    EOF
}
