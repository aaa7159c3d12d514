package com.rlang.script.parser;

/** Lexing or parsing failure. The message is prefixed with the source line. */
public class ParseError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseError(int line, String message) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public int line() { return line; }
}
