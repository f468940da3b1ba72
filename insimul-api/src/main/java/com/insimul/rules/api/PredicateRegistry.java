/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api;

import java.util.List;
import java.util.OptionalInt;

/**
 * Read-only lookup of the predicates and actions the simulator knows about.
 *
 * <p>The registry may be intentionally incomplete while authoring, so anything
 * it does not know is only ever reported as a suggestion.
 */
public interface PredicateRegistry {

    boolean isKnownPredicate(String functor);

    /**
     * Declared arity of a known predicate, or empty if the predicate is unknown
     * or accepts any number of arguments.
     */
    OptionalInt arityOf(String functor);

    boolean isKnownAction(String action);

    /**
     * Known predicate names close to an unknown one, nearest first, to help spot
     * typos.
     */
    default List<String> similarPredicates(String functor) {
        return List.of();
    }
}
