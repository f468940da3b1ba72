/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level scanning shared by the text dialects: position tracking,
 * identifiers, numbers and quoted strings.
 *
 * <p>Comment syntax, punctuation and, above all, the variable-naming convention
 * are decided by each subclass in {@link #scan()}. Lexing never throws; bad input
 * becomes an {@link Token.Type#ERROR} token that fails only the block containing it.
 */
public abstract class AbstractLexer {

    protected final String text;
    protected int pos;
    private int line = 1;
    private int column = 1;
    private boolean lineStarted;

    private int tokenLine;
    private int tokenColumn;
    private boolean tokenFirstOnLine;

    protected AbstractLexer(String text) {
        this.text = text;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(Token.Type.EOF, "", line, column, true));
                return tokens;
            }
            tokenLine = line;
            tokenColumn = column;
            tokenFirstOnLine = !lineStarted;
            Token token = scan();
            if (token != null) {
                tokens.add(token);
                lineStarted = true;
            }
        }
    }

    /**
     * Scans one token starting at the current character, consuming at least one
     * character.
     *
     * @return the token, or {@code null} for input that produces none (comments)
     */
    protected abstract Token scan();

    protected Token token(Token.Type type, String value) {
        return new Token(type, value, tokenLine, tokenColumn, tokenFirstOnLine);
    }

    protected char peekChar() {
        return peekChar(0);
    }

    protected char peekChar(int ahead) {
        int index = pos + ahead;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    protected boolean lookingAt(String s) {
        return text.startsWith(s, pos);
    }

    protected char advance() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
            lineStarted = false;
        } else {
            column++;
        }
        return c;
    }

    protected void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            advance();
        }
    }

    protected static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    protected static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected String readIdentifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            advance();
        }
        return text.substring(start, pos);
    }

    /**
     * Reads an optionally negative decimal number with optional fraction and exponent.
     */
    protected Token readNumber() {
        int start = pos;
        if (peekChar() == '-') {
            advance();
        }
        while (isDigit(peekChar())) {
            advance();
        }
        if (peekChar() == '.' && isDigit(peekChar(1))) {
            advance();
            while (isDigit(peekChar())) {
                advance();
            }
        }
        if ((peekChar() == 'e' || peekChar() == 'E')
                && (isDigit(peekChar(1)) || ((peekChar(1) == '-' || peekChar(1) == '+') && isDigit(peekChar(2))))) {
            advance(2);
            while (isDigit(peekChar())) {
                advance();
            }
        }
        return token(Token.Type.NUMBER, text.substring(start, pos));
    }

    /**
     * Reads a string delimited by {@code quote} with backslash escapes. The
     * returned token holds the unescaped content.
     */
    protected Token readQuoted(char quote) {
        advance();
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = peekChar();
            if (c == quote) {
                advance();
                return token(Token.Type.STRING, sb.toString());
            }
            if (c == '\n') {
                break;
            }
            advance();
            if (c == '\\' && pos < text.length()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        return token(Token.Type.ERROR, "Unterminated string literal");
    }

    protected String restOfLine() {
        int start = pos;
        while (pos < text.length() && text.charAt(pos) != '\n') {
            advance();
        }
        return text.substring(start, pos);
    }

    protected Token unexpected(char c) {
        advance();
        return token(Token.Type.ERROR, "Unexpected character '" + c + "'");
    }
}
