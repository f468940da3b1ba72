/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.tott;

import com.insimul.rules.compiler.dialect.AbstractLexer;
import com.insimul.rules.compiler.dialect.Token;

/**
 * Lexer for the Python-flavoured Talk of the Town syntax. Every identifier is a
 * {@link Token.Type#WORD}; the parser treats bare words in term position as
 * variables. Indentation is not significant to the parser.
 */
final class TottLexer extends AbstractLexer {

    private static final String[] OPERATORS = {"==", "!=", "<=", ">=", "<", ">"};

    TottLexer(String text) {
        super(text);
    }

    @Override
    protected Token scan() {
        char c = peekChar();
        if (c == '#') {
            advance();
            while (peekChar() == ' ' || peekChar() == '\t') {
                advance();
            }
            if (peekChar() == '@') {
                advance();
                return token(Token.Type.ANNOTATION, restOfLine().strip());
            }
            restOfLine();
            return null;
        }
        if (c == '"' || c == '\'') {
            return readQuoted(c);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekChar(1)))) {
            return readNumber();
        }
        if (isIdentifierStart(c)) {
            return token(Token.Type.WORD, readIdentifier());
        }
        for (String op : OPERATORS) {
            if (lookingAt(op)) {
                advance(op.length());
                return token(Token.Type.SYMBOL, op);
            }
        }
        if ("()[],:.=@".indexOf(c) >= 0) {
            advance();
            return token(Token.Type.SYMBOL, String.valueOf(c));
        }
        return unexpected(c);
    }
}
