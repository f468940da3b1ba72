/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Negation of a single child condition.
 */
public record Not(@JsonProperty("child") Condition child) implements Condition {

    public Not {
        Objects.requireNonNull(child, "Negated condition cannot be null");
    }

    @Override
    public void forEachPredicate(Consumer<Predicate> action) {
        child.forEachPredicate(action);
    }

    @Override
    public String toString() {
        return "not " + child;
    }
}
