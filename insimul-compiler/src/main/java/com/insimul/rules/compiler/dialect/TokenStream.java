/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.exceptions.RuleSyntaxException;
import com.insimul.rules.api.model.SourcePosition;

import java.util.List;

/**
 * Cursor over the tokens of a single rule block. The last token is always
 * {@link Token.Type#EOF}.
 */
public final class TokenStream {

    private final List<Token> tokens;
    private int index;

    public TokenStream(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != Token.Type.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public Token peek() {
        return peek(0);
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    public Token next() {
        Token token = peek();
        if (token.type() == Token.Type.ERROR) {
            throw new RuleSyntaxException(token.text(), token.position());
        }
        if (token.type() != Token.Type.EOF) {
            index++;
        }
        return token;
    }

    public boolean atEnd() {
        return peek().type() == Token.Type.EOF;
    }

    public boolean checkSymbol(String symbol) {
        return peek().isSymbol(symbol);
    }

    public boolean checkWord(String word) {
        return peek().isWord(word);
    }

    public boolean check(Token.Type type) {
        return peek().type() == type;
    }

    public boolean matchSymbol(String symbol) {
        if (checkSymbol(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    public boolean matchWord(String word) {
        if (checkWord(word)) {
            index++;
            return true;
        }
        return false;
    }

    public Token expectSymbol(String symbol) {
        if (!checkSymbol(symbol)) {
            throw unexpected("'" + symbol + "'");
        }
        return next();
    }

    public Token expectWord(String word) {
        if (!checkWord(word)) {
            throw unexpected("'" + word + "'");
        }
        return next();
    }

    public Token expect(Token.Type type, String description) {
        if (!check(type)) {
            throw unexpected(description);
        }
        return next();
    }

    public void expectEnd() {
        if (!atEnd()) {
            throw unexpected("end of rule");
        }
    }

    public SourcePosition position() {
        return peek().position();
    }

    public RuleSyntaxException unexpected(String expected) {
        Token token = peek();
        if (token.type() == Token.Type.ERROR) {
            return new RuleSyntaxException(token.text(), token.position());
        }
        return new RuleSyntaxException("Expected " + expected + " but found " + token, token.position());
    }

    public RuleSyntaxException error(String message) {
        return new RuleSyntaxException(message, position());
    }
}
