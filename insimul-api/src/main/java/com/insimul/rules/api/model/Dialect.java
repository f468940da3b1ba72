/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.insimul.rules.api.exceptions.UnknownDialectException;

/**
 * The four interchangeable surface syntaxes a rule set can be authored in.
 */
public enum Dialect {
    /** Block syntax with {@code ?}-prefixed variables; every rule field is native. */
    INSIMUL("insimul"),
    /** Ensemble JSON rule files (trigger and volition rules). */
    ENSEMBLE("ensemble"),
    /** Kismet trait declarations in Prolog style, capitalized variables. */
    KISMET("kismet"),
    /** Talk of the Town genealogy definitions in Python style. */
    TOTT("tott");

    private final String tag;

    Dialect(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Resolves a dialect tag as used by editors and persisted rule records.
     *
     * @param tag the dialect tag, case-insensitive
     * @return the matching dialect
     * @throws UnknownDialectException if the tag names no supported dialect
     */
    @JsonCreator
    public static Dialect fromTag(String tag) {
        if (tag == null) {
            throw new UnknownDialectException(null);
        }
        for (Dialect dialect : values()) {
            if (dialect.tag.equalsIgnoreCase(tag.trim())) {
                return dialect;
            }
        }
        throw new UnknownDialectException(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
