package com.rlang.script.parser;

public enum TokenType {
    // single-character
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, MINUS, PLUS, SEMICOLON, SLASH, STAR, PERCENT,

    // one or two characters
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,

    // literals
    IDENTIFIER, STRING, NUMBER,

    // keywords
    AND, OR, IF, ELSE, WHILE, FOR, TRUE, FALSE, NIL, FN, VAR, PRINT, RETURN,

    EOF
}
