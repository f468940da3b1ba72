/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Rules parsed from one document plus everything the parser had to say about it.
 * An empty rule list is a normal outcome, not a failure.
 */
public record CompilationResult(List<Rule> rules, List<Diagnostic> diagnostics) {

    public CompilationResult {
        rules = List.copyOf(rules);
        diagnostics = List.copyOf(diagnostics);
    }

    @JsonIgnore
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
