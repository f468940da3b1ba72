/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Disjunction of child conditions.
 */
public record Or(@JsonProperty("children") List<Condition> children) implements Condition {

    public Or {
        children = List.copyOf(children);
    }

    @Override
    public void forEachPredicate(Consumer<Predicate> action) {
        children.forEach(child -> child.forEachPredicate(action));
    }

    @Override
    public String toString() {
        return children.stream().map(String::valueOf).collect(Collectors.joining(" or ", "(", ")"));
    }
}
