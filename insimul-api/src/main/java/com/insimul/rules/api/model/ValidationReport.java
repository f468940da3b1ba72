/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating a rule set. Only errors affect {@code isValid}.
 */
public record ValidationReport(
        @JsonProperty("isValid") boolean isValid,
        @JsonProperty("errors") List<Diagnostic> errors,
        @JsonProperty("warnings") List<Diagnostic> warnings,
        @JsonProperty("suggestions") List<Diagnostic> suggestions
) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
    }

    /**
     * Splits diagnostics by severity, keeping their relative order.
     */
    public static ValidationReport of(List<Diagnostic> diagnostics) {
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        List<Diagnostic> suggestions = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            switch (diagnostic.severity()) {
                case ERROR -> errors.add(diagnostic);
                case WARNING -> warnings.add(diagnostic);
                case SUGGESTION -> suggestions.add(diagnostic);
            }
        }
        return new ValidationReport(errors.isEmpty(), errors, warnings, suggestions);
    }
}
