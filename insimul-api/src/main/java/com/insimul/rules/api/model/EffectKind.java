/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * What an effect does when the simulator fires the rule.
 */
public enum EffectKind {
    STATE_CHANGE("set"),
    EVENT("emit"),
    CREATE_ENTITY("create"),
    /** Invokes the template engine at run time; the first argument names the template. */
    TEXT_GENERATION("generate");

    private final String keyword;

    EffectKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The keyword text dialects use to mark this kind explicitly.
     */
    @JsonValue
    public String keyword() {
        return keyword;
    }

    public static Optional<EffectKind> fromKeyword(String keyword) {
        for (EffectKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EffectKind fromJson(String value) {
        return fromKeyword(value).orElseGet(() -> valueOf(value.toUpperCase()));
    }

    /**
     * The kind an action conventionally has, judged by its name.
     * Dialects only spell the kind out when it differs from this.
     */
    public static EffectKind infer(String action) {
        if (action.startsWith("create_")) {
            return CREATE_ENTITY;
        }
        if (action.startsWith("tracery_")) {
            return TEXT_GENERATION;
        }
        if (action.startsWith("trigger_") || action.startsWith("emit_")) {
            return EVENT;
        }
        return STATE_CHANGE;
    }
}
