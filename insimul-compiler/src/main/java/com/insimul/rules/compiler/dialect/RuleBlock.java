/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.model.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * The tokens of one rule as cut out of a document by a dialect's segmenter.
 *
 * @param nameHint best-effort rule name used to label diagnostics when the block
 *                 fails to parse; may be null
 */
public record RuleBlock(List<Token> tokens, SourcePosition start, String nameHint) {

    /**
     * Creates a block from {@code tokens[from, to)}, terminated with a synthetic EOF.
     */
    public static RuleBlock slice(List<Token> tokens, int from, int to, String nameHint) {
        List<Token> body = new ArrayList<>(tokens.subList(from, to));
        Token last = to < tokens.size() ? tokens.get(to) : tokens.get(tokens.size() - 1);
        body.add(new Token(Token.Type.EOF, "", last.line(), last.column(), last.firstOnLine()));
        return new RuleBlock(body, tokens.get(from).position(), nameHint);
    }

    public TokenStream stream() {
        return new TokenStream(tokens);
    }
}
