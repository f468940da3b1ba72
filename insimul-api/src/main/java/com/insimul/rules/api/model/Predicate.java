/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A predicate call such as {@code parent_of(?lord, ?heir)}.
 *
 * <p>Infix comparisons are predicates too: the functor is the operator symbol
 * ({@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >}, {@code >=}) and the
 * call has exactly two arguments. Arity is not checked here; a call may refer
 * to a predicate that is not registered yet.
 */
public record Predicate(String functor, List<Term> args) implements Condition {

    public static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=");

    public Predicate {
        Objects.requireNonNull(functor, "Predicate functor cannot be null");
        if (functor.isEmpty()) {
            throw new IllegalArgumentException("Predicate functor cannot be empty");
        }
        args = List.copyOf(args);
    }

    public static Predicate of(String functor, Term... args) {
        return new Predicate(functor, List.of(args));
    }

    public static Predicate comparison(String operator, Term left, Term right) {
        if (!COMPARISON_OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Unknown comparison operator: " + operator);
        }
        return new Predicate(operator, List.of(left, right));
    }

    @JsonIgnore
    public boolean isComparison() {
        return args.size() == 2 && COMPARISON_OPERATORS.contains(functor);
    }

    @JsonIgnore
    public int arity() {
        return args.size();
    }

    @Override
    public void forEachPredicate(Consumer<Predicate> action) {
        action.accept(this);
    }

    @Override
    public String toString() {
        if (isComparison()) {
            return args.get(0) + " " + functor + " " + args.get(1);
        }
        StringBuilder sb = new StringBuilder(functor).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
