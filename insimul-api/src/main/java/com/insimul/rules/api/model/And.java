/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Conjunction of child conditions. With no children it holds unconditionally.
 */
public record And(@JsonProperty("children") List<Condition> children) implements Condition {

    public And {
        children = List.copyOf(children);
    }

    @Override
    @JsonIgnore
    public boolean isAlways() {
        return children.isEmpty();
    }

    @Override
    public void forEachPredicate(Consumer<Predicate> action) {
        children.forEach(child -> child.forEachPredicate(action));
    }

    @Override
    public String toString() {
        return children.isEmpty() ? "true"
                : children.stream().map(String::valueOf).collect(Collectors.joining(" and ", "(", ")"));
    }
}
