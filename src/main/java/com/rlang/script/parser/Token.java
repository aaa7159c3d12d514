package com.rlang.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;

    public Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    /** Synthetic token for hosts that build an AST without source text. */
    public static Token of(TokenType type, String lexeme) {
        return new Token(type, lexeme, null, 0);
    }

    public static Token identifier(String name) {
        return of(TokenType.IDENTIFIER, name);
    }

    @Override
    public String toString() {
        return type + " " + lexeme + (literal == null ? "" : " " + literal);
    }
}
