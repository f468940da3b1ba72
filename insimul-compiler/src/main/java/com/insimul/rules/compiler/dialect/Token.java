/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.model.SourcePosition;

/**
 * A lexical token. What counts as a {@link Type#VARIABLE} is decided by each
 * dialect's lexer.
 *
 * @param firstOnLine true when no other token precedes this one on its line
 */
public record Token(Type type, String text, int line, int column, boolean firstOnLine) {

    public enum Type {
        WORD,
        VARIABLE,
        STRING,
        NUMBER,
        SYMBOL,
        /** Comment-borne metadata such as {@code % @priority 9}; text is everything after the {@code @}. */
        ANNOTATION,
        /** Clause terminator in dialects that end rules with a period. */
        TERMINATOR,
        /** Unlexable input; text holds the reason. */
        ERROR,
        EOF
    }

    public SourcePosition position() {
        return new SourcePosition(line, column);
    }

    public boolean is(Type type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isSymbol(String symbol) {
        return is(Type.SYMBOL, symbol);
    }

    public boolean isWord(String word) {
        return is(Type.WORD, word);
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of input" : "'" + text + "'";
    }
}
