/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.kismet;

import com.insimul.rules.compiler.dialect.AbstractLexer;
import com.insimul.rules.compiler.dialect.Token;

/**
 * Lexer for Kismet's Prolog-style clauses. Identifiers starting with an upper
 * case letter or an underscore are variables. A period glued between a name and
 * an identifier is a field access; any other period ends a clause.
 */
final class KismetLexer extends AbstractLexer {

    private static final String[] OPERATORS = {":-", "\\+", "\\=", "==", "=<", ">=", "<", ">"};

    KismetLexer(String text) {
        super(text);
    }

    @Override
    protected Token scan() {
        char c = peekChar();
        if (c == '%') {
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
        if (c == '\'' || c == '"') {
            return readQuoted(c);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekChar(1)))) {
            return readNumber();
        }
        if (isIdentifierStart(c)) {
            String identifier = readIdentifier();
            boolean variable = Character.isUpperCase(identifier.charAt(0)) || identifier.charAt(0) == '_';
            return token(variable ? Token.Type.VARIABLE : Token.Type.WORD, identifier);
        }
        if (c == '.') {
            boolean fieldAccess = pos > 0 && (isIdentifierPart(text.charAt(pos - 1)) || text.charAt(pos - 1) == '\'')
                    && isIdentifierStart(peekChar(1));
            advance();
            return fieldAccess ? token(Token.Type.SYMBOL, ".") : token(Token.Type.TERMINATOR, ".");
        }
        for (String op : OPERATORS) {
            if (lookingAt(op)) {
                advance(op.length());
                return token(Token.Type.SYMBOL, op);
            }
        }
        if ("()[],;:".indexOf(c) >= 0) {
            advance();
            return token(Token.Type.SYMBOL, String.valueOf(c));
        }
        return unexpected(c);
    }
}
