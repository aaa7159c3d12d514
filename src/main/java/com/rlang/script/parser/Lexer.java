package com.rlang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns rlang source into tokens. Whitespace and {@code //} comments are
 * dropped; every token records the line it ends on.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS;
    private static final Map<Character, TokenType> SINGLE;
    // '!' '=' '<' '>' followed by '=' become the paired type.
    private static final Map<TokenType, TokenType> WITH_EQUALS = new EnumMap<>(TokenType.class);

    static {
        Map<String, TokenType> kw = new HashMap<>();
        for (TokenType t : new TokenType[] {
                TokenType.AND, TokenType.OR, TokenType.IF, TokenType.ELSE, TokenType.WHILE,
                TokenType.FOR, TokenType.TRUE, TokenType.FALSE, TokenType.NIL, TokenType.FN,
                TokenType.VAR, TokenType.PRINT, TokenType.RETURN }) {
            kw.put(t.name().toLowerCase(Locale.ROOT), t);
        }
        KEYWORDS = Collections.unmodifiableMap(kw);

        Map<Character, TokenType> single = new HashMap<>();
        single.put('(', TokenType.LEFT_PAREN);
        single.put(')', TokenType.RIGHT_PAREN);
        single.put('{', TokenType.LEFT_BRACE);
        single.put('}', TokenType.RIGHT_BRACE);
        single.put(',', TokenType.COMMA);
        single.put(';', TokenType.SEMICOLON);
        single.put('+', TokenType.PLUS);
        single.put('-', TokenType.MINUS);
        single.put('*', TokenType.STAR);
        single.put('%', TokenType.PERCENT);
        single.put('/', TokenType.SLASH);
        single.put('!', TokenType.BANG);
        single.put('=', TokenType.EQUAL);
        single.put('<', TokenType.LESS);
        single.put('>', TokenType.GREATER);
        SINGLE = Collections.unmodifiableMap(single);

        WITH_EQUALS.put(TokenType.BANG, TokenType.BANG_EQUAL);
        WITH_EQUALS.put(TokenType.EQUAL, TokenType.EQUAL_EQUAL);
        WITH_EQUALS.put(TokenType.LESS, TokenType.LESS_EQUAL);
        WITH_EQUALS.put(TokenType.GREATER, TokenType.GREATER_EQUAL);
    }

    private final String src;
    private final List<Token> out = new ArrayList<>();
    private int tokenStart;
    private int pos;
    private int line = 1;

    public Lexer(String source) {
        this.src = source;
    }

    public List<Token> tokenize() {
        for (skipTrivia(); pos < src.length(); skipTrivia()) {
            tokenStart = pos;
            char c = src.charAt(pos++);
            if (c == '"') {
                readString();
            } else if (isAsciiDigit(c)) {
                readNumber();
            } else if (startsName(c)) {
                readName();
            } else {
                readOperator(c);
            }
        }
        out.add(new Token(TokenType.EOF, "", null, line));
        return out;
    }

    /** Skips blanks, newlines and line comments. */
    private void skipTrivia() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '/' && charAt(pos + 1) == '/') {
                int eol = src.indexOf('\n', pos);
                pos = (eol < 0) ? src.length() : eol;
            } else {
                return;
            }
        }
    }

    private void readOperator(char c) {
        TokenType type = SINGLE.get(c);
        if (type == null) throw error(line, "Unexpected character: " + c);
        TokenType paired = WITH_EQUALS.get(type);
        if (paired != null && charAt(pos) == '=') {
            pos++;
            type = paired;
        }
        emit(type, null);
    }

    private void readString() {
        int opened = line;
        int close = src.indexOf('"', pos);
        if (close < 0) throw error(opened, "Unterminated string");
        String body = src.substring(pos, close);
        for (int i = 0; i < body.length(); i++) {
            if (body.charAt(i) == '\n') line++;
        }
        pos = close + 1;
        emit(TokenType.STRING, body);
    }

    // digits ( '.' digits )?  A trailing dot is not part of the number.
    private void readNumber() {
        skipDigits();
        if (charAt(pos) == '.' && isAsciiDigit(charAt(pos + 1))) {
            pos++;
            skipDigits();
        }
        emit(TokenType.NUMBER, Double.valueOf(src.substring(tokenStart, pos)));
    }

    private void readName() {
        while (startsName(charAt(pos)) || isAsciiDigit(charAt(pos))) pos++;
        String word = src.substring(tokenStart, pos);
        emit(KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER), null);
    }

    private void skipDigits() {
        while (isAsciiDigit(charAt(pos))) pos++;
    }

    private char charAt(int i) {
        return (i < src.length()) ? src.charAt(i) : '\0';
    }

    private static boolean isAsciiDigit(char c) { return c >= '0' && c <= '9'; }

    private static boolean startsName(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private void emit(TokenType type, Object literal) {
        out.add(new Token(type, src.substring(tokenStart, pos), literal, line));
    }

    private static ParseError error(int atLine, String msg) {
        return new ParseError(atLine, msg);
    }
}
