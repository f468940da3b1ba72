/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler;

import com.insimul.rules.api.IRuleCompiler;
import com.insimul.rules.api.PredicateRegistry;
import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.DialectSwitchResult;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Severity;
import com.insimul.rules.api.model.ValidationReport;
import com.insimul.rules.compiler.cache.CompiledOutputCache;
import com.insimul.rules.compiler.dialect.DialectRegistry;
import com.insimul.rules.compiler.dialect.prolog.PrologEmitter;
import com.insimul.rules.compiler.validation.RuleValidator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Entry point of the rule compiler: parses any dialect into canonical rules,
 * validates them, and renders them back out as any dialect.
 *
 * <p>Stateless apart from the render cache, so one instance can serve many
 * threads. Content problems surface as diagnostics; only a null argument or an
 * unregistered dialect throws.
 */
public class UnifiedRuleCompiler implements IRuleCompiler {
    private static final Logger logger = Logger.getLogger(UnifiedRuleCompiler.class.getName());

    private final DialectRegistry dialects;
    private final CompiledOutputCache outputCache;
    private final PrologEmitter prologEmitter = new PrologEmitter();
    private volatile Tracer tracer;
    private volatile PredicateRegistry predicateRegistry;

    /**
     * Built-in dialects, no-op tracing and no predicate registry. This is the
     * constructor {@link java.util.ServiceLoader} uses.
     */
    public UnifiedRuleCompiler() {
        this(OpenTelemetry.noop().getTracer(UnifiedRuleCompiler.class.getName()));
    }

    public UnifiedRuleCompiler(Tracer tracer) {
        this(tracer, DialectRegistry.defaults(), null, CompiledOutputCache.withDefaults());
    }

    public UnifiedRuleCompiler(Tracer tracer, DialectRegistry dialects, PredicateRegistry predicateRegistry,
                               CompiledOutputCache outputCache) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.dialects = Objects.requireNonNull(dialects, "dialects");
        this.predicateRegistry = predicateRegistry;
        this.outputCache = Objects.requireNonNull(outputCache, "outputCache");
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setPredicateRegistry(PredicateRegistry registry) {
        this.predicateRegistry = registry;
    }

    @Override
    public CompilationResult compile(String content, Dialect dialect) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(dialect, "dialect");
        Span span = tracer.spanBuilder("compile-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("dialect", dialect.tag());
            long startTime = System.nanoTime();

            CompilationResult result = dialects.parser(dialect).parse(content);

            span.setAttribute("ruleCount", result.rules().size());
            span.setAttribute("diagnosticCount", result.diagnostics().size());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public String export(List<Rule> rules, Dialect dialect, RenderOptions options) {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(dialect, "dialect");
        RenderOptions effective = options != null ? options : RenderOptions.DEFAULT;
        Span span = tracer.spanBuilder("export-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("dialect", dialect.tag());
            span.setAttribute("ruleCount", rules.size());
            return outputCache.get(rules, dialect, effective,
                    () -> dialects.emitter(dialect).render(rules, effective));
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public String exportProlog(List<Rule> rules, RenderOptions options) {
        Objects.requireNonNull(rules, "rules");
        RenderOptions effective = options != null ? options : RenderOptions.DEFAULT;
        Span span = tracer.spanBuilder("export-prolog").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleCount", rules.size());
            return prologEmitter.render(rules, effective);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public ValidationReport validate(String content, Dialect dialect) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(dialect, "dialect");
        if (content.isBlank()) {
            return ValidationReport.of(List.of(Diagnostic.error(Diagnostic.Category.STRUCTURE, null, null,
                    "Rule content cannot be empty")));
        }
        CompilationResult parsed = compile(content, dialect);
        List<Diagnostic> diagnostics = new ArrayList<>(parsed.diagnostics());
        diagnostics.addAll(runValidator(parsed.rules()));
        return ValidationReport.of(diagnostics);
    }

    @Override
    public ValidationReport validate(List<Rule> rules) {
        Objects.requireNonNull(rules, "rules");
        return ValidationReport.of(runValidator(rules));
    }

    private List<Diagnostic> runValidator(List<Rule> rules) {
        Span span = tracer.spanBuilder("validate-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleCount", rules.size());
            List<Diagnostic> diagnostics = new RuleValidator(predicateRegistry).validate(rules);
            span.setAttribute("diagnosticCount", diagnostics.size());
            return diagnostics;
        } finally {
            span.end();
        }
    }

    /**
     * Converts a document only when it yields at least one rule under the source
     * dialect. Otherwise the content comes back untouched with a warning, so an
     * editor can never lose its text to a failed conversion.
     */
    @Override
    public DialectSwitchResult switchDialect(String content, Dialect from, Dialect to) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Span span = tracer.spanBuilder("switch-dialect").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("from", from.tag());
            span.setAttribute("to", to.tag());
            if (from == to) {
                return DialectSwitchResult.unchanged(content, from, null);
            }

            CompilationResult parsed = compile(content, from);
            if (parsed.rules().isEmpty()) {
                logger.warning(String.format("Content does not parse as %s; keeping it unchanged instead of switching to %s",
                        from, to));
                span.setAttribute("converted", false);
                return DialectSwitchResult.unchanged(content, from, Diagnostic.warning(
                        Diagnostic.Category.CONVERSION, null, null,
                        "Content does not parse as " + from + "; dialect left unchanged"));
            }

            String converted = export(parsed.rules(), to, RenderOptions.DEFAULT);
            long dropped = parsed.diagnostics().stream()
                    .filter(d -> d.severity() == Severity.ERROR)
                    .count();
            Diagnostic warning = dropped == 0 ? null : Diagnostic.warning(Diagnostic.Category.CONVERSION, null, null,
                    dropped + " malformed block(s) could not be parsed and are missing from the converted document");
            logger.info(String.format("Switched %d rule(s) from %s to %s", parsed.rules().size(), from, to));
            span.setAttribute("converted", true);
            return DialectSwitchResult.converted(converted, to, warning);
        } finally {
            span.end();
        }
    }

    /**
     * Renderings of the rule that are currently cached, by dialect.
     *
     * <p>Only single-rule exports with {@link RenderOptions#DEFAULT} are cached
     * per rule, so this is empty for a rule that has only been exported as part
     * of a larger document or with other options.
     */
    public Map<Dialect, String> compiledOutput(Rule rule) {
        return outputCache.compiledOutput(rule);
    }

    public DialectRegistry dialects() {
        return dialects;
    }

    public CompiledOutputCache outputCache() {
        return outputCache;
    }
}
