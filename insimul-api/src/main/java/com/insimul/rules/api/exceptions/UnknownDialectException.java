/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.exceptions;

/**
 * Thrown when a caller passes a dialect tag that no parser or emitter is registered for.
 *
 * <p>This is programming misuse rather than malformed content, so it is unchecked
 * and is never converted into a diagnostic.
 */
public class UnknownDialectException extends RuntimeException {

    private final String dialectTag;

    public UnknownDialectException(String dialectTag) {
        super("Unsupported dialect: " + dialectTag + " (supported: insimul, ensemble, kismet, tott)");
        this.dialectTag = dialectTag;
    }

    public String getDialectTag() {
        return dialectTag;
    }
}
