/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.exceptions;

import com.insimul.rules.api.model.SourcePosition;

/**
 * Raised inside a dialect parser when a rule block is malformed. Parsers turn it
 * into an error diagnostic for that block and move on to the next one, so it
 * never escapes {@link com.insimul.rules.api.DialectParser#parse(String)}.
 */
public class RuleSyntaxException extends RuntimeException {

    private final SourcePosition position;

    public RuleSyntaxException(String message, SourcePosition position) {
        super(message);
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
