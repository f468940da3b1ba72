/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * One action a rule performs, e.g. {@code inherit_title(?heir, ?lord.title)}.
 *
 * <p>For {@link EffectKind#TEXT_GENERATION} effects this core only records the
 * template reference; expansion happens in the simulator.
 */
public record Effect(String action, List<Term> args, EffectKind kind) {

    public Effect {
        Objects.requireNonNull(action, "Effect action cannot be null");
        if (action.isEmpty()) {
            throw new IllegalArgumentException("Effect action cannot be empty");
        }
        args = List.copyOf(args);
        if (kind == null) {
            kind = EffectKind.infer(action);
        }
    }

    /**
     * Creates an effect whose kind follows the action-name convention.
     */
    public static Effect of(String action, Term... args) {
        return new Effect(action, List.of(args), null);
    }

    /**
     * True when the kind differs from what {@link EffectKind#infer} would give,
     * so text dialects have to spell it out.
     */
    @JsonIgnore
    public boolean hasExplicitKind() {
        return kind != EffectKind.infer(action);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (hasExplicitKind()) {
            sb.append(kind.keyword()).append(' ');
        }
        sb.append(action).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
