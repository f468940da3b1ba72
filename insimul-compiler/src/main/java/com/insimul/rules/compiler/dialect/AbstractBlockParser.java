/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.DialectParser;
import com.insimul.rules.api.exceptions.RuleSyntaxException;
import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for the text dialects. A document is lexed once, cut into rule
 * blocks, and each block is parsed on its own: a malformed block yields one
 * error diagnostic and never affects its neighbours.
 */
public abstract class AbstractBlockParser implements DialectParser {
    private static final Logger logger = Logger.getLogger(AbstractBlockParser.class.getName());

    @Override
    public CompilationResult parse(String content) {
        if (content == null || content.isBlank()) {
            return new CompilationResult(List.of(), List.of());
        }
        List<Token> tokens = newLexer(content).tokenize();
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<RuleBlock> blocks = segment(tokens, diagnostics);

        List<Rule> rules = new ArrayList<>(blocks.size());
        for (RuleBlock block : blocks) {
            List<Diagnostic> blockDiagnostics = new ArrayList<>();
            try {
                rules.add(parseBlock(block.stream(), blockDiagnostics).sourceDialect(dialect()).build());
                diagnostics.addAll(blockDiagnostics);
            } catch (RuleSyntaxException e) {
                logger.log(Level.FINE, "Skipping malformed {0} block at {1}: {2}",
                        new Object[]{dialect(), e.getPosition(), e.getMessage()});
                diagnostics.add(Diagnostic.error(Diagnostic.Category.PARSE, block.nameHint(),
                        e.getPosition() != null ? e.getPosition() : block.start(),
                        "Malformed rule block: " + e.getMessage()));
            }
        }
        return new CompilationResult(rules, diagnostics);
    }

    protected abstract AbstractLexer newLexer(String content);

    /**
     * Cuts the token list into rule blocks. Content that belongs to no block is
     * reported into {@code diagnostics}.
     */
    protected abstract List<RuleBlock> segment(List<Token> tokens, List<Diagnostic> diagnostics);

    /**
     * Parses exactly one rule from the block, consuming all of its tokens.
     *
     * @throws RuleSyntaxException when the block is malformed
     */
    protected abstract Rule.Builder parseBlock(TokenStream tokens, List<Diagnostic> diagnostics);

    /**
     * Reports tokens that precede the first rule block as a single error.
     */
    protected static void reportStray(List<Token> tokens, int from, int to, List<Diagnostic> diagnostics) {
        if (from >= to || tokens.get(from).type() == Token.Type.EOF) {
            return;
        }
        Token first = tokens.get(from);
        diagnostics.add(Diagnostic.error(Diagnostic.Category.PARSE, null, first.position(),
                "Unexpected content outside of a rule: " + first));
    }
}
