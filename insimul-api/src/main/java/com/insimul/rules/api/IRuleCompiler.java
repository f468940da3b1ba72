/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api;

import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.DialectSwitchResult;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.ValidationReport;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Contract for the unified rule compiler: parse any dialect, validate, and
 * re-emit as any dialect.
 *
 * <p>All operations are synchronous and side-effect free. Malformed content is
 * reported through diagnostics; only programming misuse (a null argument or an
 * unsupported dialect) throws.
 */
public interface IRuleCompiler {

    /**
     * Parses rule source text written in the given dialect.
     */
    CompilationResult compile(String content, Dialect dialect);

    /**
     * Renders rules as the given dialect.
     */
    String export(List<Rule> rules, Dialect dialect, RenderOptions options);

    /**
     * Renders rules as a consultable SWI-Prolog program. This is a one-way
     * export: Prolog is not a dialect and its output cannot be compiled back.
     */
    String exportProlog(List<Rule> rules, RenderOptions options);

    /**
     * Parses the content and validates the resulting rules. Parse diagnostics
     * are merged into the report by severity.
     */
    ValidationReport validate(String content, Dialect dialect);

    /**
     * Validates already parsed rules.
     */
    ValidationReport validate(List<Rule> rules);

    /**
     * Converts a document to another dialect, or leaves it untouched with a
     * warning when it yields no rules under the declared source dialect.
     */
    DialectSwitchResult switchDialect(String content, Dialect from, Dialect to);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets the registry of known predicates and actions used for suggestion-level
     * checks.
     *
     * @param registry the registry (null to disable those checks)
     */
    default void setPredicateRegistry(PredicateRegistry registry) {
    }
}
