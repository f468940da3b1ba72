/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.exceptions;

import java.util.List;

/**
 * Raised when dependency-ordered processing is requested for rules whose
 * dependencies form a cycle.
 *
 * <p>A cycle blocks ordering but never blocks storing or editing the rules; the
 * validator reports the same condition as an error diagnostic instead of throwing.
 */
public class DependencyCycleException extends RuntimeException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Every rule on the cycle, in dependency order starting from the rule where
     * the traversal entered the cycle.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
