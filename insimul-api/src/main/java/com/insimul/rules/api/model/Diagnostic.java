/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A structured finding from parsing or validation.
 *
 * @param severity error, warning or suggestion
 * @param category which part of the error taxonomy produced it
 * @param message  human-readable explanation
 * @param ruleName the rule it concerns, or {@code null} for document-level findings
 * @param position where in the source it was found, or {@code null} when unknown
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        Severity severity,
        Category category,
        String message,
        String ruleName,
        SourcePosition position
) {

    /**
     * Error taxonomy. Parse, range, reference and cycle findings follow the
     * compiler's recovery policy: parse errors isolate one rule, range and
     * reference findings are soft, cycles block ordering only.
     */
    public enum Category {
        PARSE,
        RANGE,
        REFERENCE,
        CYCLE,
        DUPLICATE,
        STRUCTURE,
        STYLE,
        CONVERSION;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public static Diagnostic error(Category category, String ruleName, SourcePosition position, String message) {
        return new Diagnostic(Severity.ERROR, category, message, ruleName, position);
    }

    public static Diagnostic warning(Category category, String ruleName, SourcePosition position, String message) {
        return new Diagnostic(Severity.WARNING, category, message, ruleName, position);
    }

    public static Diagnostic suggestion(Category category, String ruleName, SourcePosition position, String message) {
        return new Diagnostic(Severity.SUGGESTION, category, message, ruleName, position);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(severity.getValue()).append(' ').append(category.getValue());
        if (position != null) sb.append(" at ").append(position);
        if (ruleName != null) sb.append(" [").append(ruleName).append(']');
        return sb.append(": ").append(message).toString();
    }
}
