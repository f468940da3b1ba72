/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.insimul;

import com.insimul.rules.compiler.dialect.AbstractLexer;
import com.insimul.rules.compiler.dialect.Token;

/**
 * Lexer for the Insimul block syntax. Variables carry a {@code ?} sigil; words
 * may contain hyphens so that rule types like {@code default-trait} stay whole.
 */
final class InsimulLexer extends AbstractLexer {

    private static final String[] OPERATORS = {"==", "!=", "<=", ">=", "<", ">"};

    InsimulLexer(String text) {
        super(text);
    }

    @Override
    protected Token scan() {
        char c = peekChar();
        if (lookingAt("//")) {
            restOfLine();
            return null;
        }
        if (lookingAt("/*")) {
            return skipBlockComment();
        }
        if (c == '?') {
            advance();
            if (!isIdentifierStart(peekChar())) {
                return token(Token.Type.ERROR, "Expected a variable name after '?'");
            }
            return token(Token.Type.VARIABLE, readIdentifier());
        }
        if (c == '"' || c == '\'') {
            return readQuoted(c);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekChar(1)))) {
            return readNumber();
        }
        if (isIdentifierStart(c)) {
            int start = pos;
            while (isIdentifierPart(peekChar()) || (peekChar() == '-' && isIdentifierStart(peekChar(1)))) {
                advance();
            }
            return token(Token.Type.WORD, text.substring(start, pos));
        }
        for (String op : OPERATORS) {
            if (lookingAt(op)) {
                advance(op.length());
                return token(Token.Type.SYMBOL, op);
            }
        }
        if ("{}()[],;:.".indexOf(c) >= 0) {
            advance();
            return token(Token.Type.SYMBOL, String.valueOf(c));
        }
        return unexpected(c);
    }

    private Token skipBlockComment() {
        advance(2);
        while (pos < text.length() && !lookingAt("*/")) {
            advance();
        }
        if (pos >= text.length()) {
            return token(Token.Type.ERROR, "Unterminated block comment");
        }
        advance(2);
        return null;
    }
}
