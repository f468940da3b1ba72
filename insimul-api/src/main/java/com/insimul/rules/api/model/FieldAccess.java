/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import java.util.Objects;

/**
 * Reads a named field of another term, e.g. {@code ?lord.title}.
 * Chains such as {@code ?a.b.c} nest left to right.
 */
public record FieldAccess(Term target, String field) implements Term {

    public FieldAccess {
        Objects.requireNonNull(target, "Field access target cannot be null");
        Objects.requireNonNull(field, "Field name cannot be null");
        if (field.isEmpty()) {
            throw new IllegalArgumentException("Field name cannot be empty");
        }
    }

    @Override
    public Variable rootVariable() {
        return target.rootVariable();
    }

    @Override
    public String toString() {
        return target + "." + field;
    }
}
