/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api;

import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Dialect;

/**
 * Parses one surface syntax into canonical rules.
 *
 * <p>Implementations are fault-isolated per rule block: a malformed block yields
 * one error diagnostic and is left out of the result while the rest of the
 * document is still parsed. Malformed content never throws.
 */
public interface DialectParser {

    /**
     * The dialect this parser reads.
     */
    Dialect dialect();

    /**
     * Parses a whole document.
     *
     * @param text the source text, never null
     * @return the well-formed rules in document order plus diagnostics
     */
    CompilationResult parse(String text);
}
