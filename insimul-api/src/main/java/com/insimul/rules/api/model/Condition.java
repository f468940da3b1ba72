/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.function.Consumer;

/**
 * A node of a rule's condition tree: a leaf {@link Predicate} or one of the
 * {@link And}, {@link Or} and {@link Not} combinators.
 *
 * <p>Parsers build trees through the static factories, which collapse a
 * single-child {@code and}/{@code or} into the child. Because every dialect
 * parser goes through the same factories, a tree re-parsed from any emitter's
 * output has the same shape as the tree that was emitted.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Predicate.class, name = "predicate"),
        @JsonSubTypes.Type(value = And.class, name = "and"),
        @JsonSubTypes.Type(value = Or.class, name = "or"),
        @JsonSubTypes.Type(value = Not.class, name = "not")
})
public interface Condition {

    And ALWAYS = new And(List.of());

    /**
     * The condition of a rule that has none: an empty conjunction.
     */
    static Condition always() {
        return ALWAYS;
    }

    static Condition and(List<Condition> children) {
        return children.size() == 1 ? children.get(0) : new And(children);
    }

    static Condition or(List<Condition> children) {
        return children.size() == 1 ? children.get(0) : new Or(children);
    }

    static Condition not(Condition child) {
        return new Not(child);
    }

    /**
     * True for the empty conjunction, which holds unconditionally.
     */
    @JsonIgnore
    default boolean isAlways() {
        return false;
    }

    /**
     * Visits every leaf predicate in depth-first, left-to-right order.
     */
    void forEachPredicate(Consumer<Predicate> action);
}
