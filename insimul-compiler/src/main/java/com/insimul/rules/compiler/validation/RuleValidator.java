/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.validation;

import com.insimul.rules.api.PredicateRegistry;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.EffectKind;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.compiler.registry.DependencyGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Checks a rule set and reports problems as diagnostics, never by throwing.
 *
 * <p>Diagnostics come out in a stable order: per rule in input order, then the
 * dependency cycles of the whole set. Running the validator twice on the same
 * rules gives the same list.
 */
public class RuleValidator {

    private final PredicateRegistry registry;

    /**
     * A validator without a predicate registry; vocabulary checks are skipped.
     */
    public RuleValidator() {
        this(null);
    }

    public RuleValidator(PredicateRegistry registry) {
        this.registry = registry;
    }

    public List<Diagnostic> validate(List<Rule> rules) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> names = new HashSet<>();
        rules.forEach(rule -> names.add(rule.name()));

        Set<String> seen = new HashSet<>();
        for (Rule rule : rules) {
            if (!seen.add(rule.name())) {
                diagnostics.add(Diagnostic.error(Diagnostic.Category.DUPLICATE, rule.name(), null,
                        "Duplicate rule name '" + rule.name() + "'"));
            }
            checkStructure(rule, diagnostics);
            checkTags(rule, diagnostics);
            checkDependencies(rule, names, diagnostics);
            checkEffects(rule, diagnostics);
            if (registry != null) {
                checkVocabulary(rule, diagnostics);
            }
        }

        for (List<String> cycle : DependencyGraph.of(rules).findCycles()) {
            diagnostics.add(Diagnostic.error(Diagnostic.Category.CYCLE, cycle.get(0), null,
                    "Dependency cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0)));
        }
        return diagnostics;
    }

    private static void checkStructure(Rule rule, List<Diagnostic> diagnostics) {
        if (rule.name().isBlank()) {
            diagnostics.add(Diagnostic.error(Diagnostic.Category.STRUCTURE, rule.name(), null,
                    "Rule name cannot be empty"));
        }
        if (rule.effects().isEmpty()) {
            diagnostics.add(Diagnostic.warning(Diagnostic.Category.STRUCTURE, rule.name(), null,
                    "Rule has no effects"));
        }
        if (rule.conditions().isAlways()) {
            diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.STRUCTURE, rule.name(), null,
                    "Rule has no conditions and applies unconditionally"));
        }
    }

    private static void checkTags(Rule rule, List<Diagnostic> diagnostics) {
        Map<String, String> byLowerCase = new HashMap<>();
        for (String tag : rule.tags()) {
            if (tag.isBlank()) {
                diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.STYLE, rule.name(), null,
                        "Empty tag"));
                continue;
            }
            String previous = byLowerCase.putIfAbsent(tag.toLowerCase(Locale.ROOT), tag);
            if (previous != null) {
                diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.DUPLICATE, rule.name(), null,
                        "Tags '" + previous + "' and '" + tag + "' differ only by case"));
            }
        }
    }

    private static void checkDependencies(Rule rule, Set<String> names, List<Diagnostic> diagnostics) {
        for (String dependency : new LinkedHashSet<>(rule.dependencies())) {
            if (!names.contains(dependency)) {
                diagnostics.add(Diagnostic.warning(Diagnostic.Category.REFERENCE, rule.name(), null,
                        "Dependency '" + dependency + "' does not name a rule in this set"));
            }
        }
    }

    private static void checkEffects(Rule rule, List<Diagnostic> diagnostics) {
        for (Effect effect : rule.effects()) {
            if (effect.kind() == EffectKind.TEXT_GENERATION
                    && (effect.args().isEmpty()
                    || !(effect.args().get(0) instanceof Constant c && c.isString()))) {
                diagnostics.add(Diagnostic.warning(Diagnostic.Category.STRUCTURE, rule.name(), null,
                        "Text generation effect '" + effect.action()
                                + "' needs a template name as its first argument"));
            }
        }
    }

    private void checkVocabulary(Rule rule, List<Diagnostic> diagnostics) {
        Set<String> reported = new HashSet<>();
        rule.conditions().forEachPredicate(predicate -> {
            if (predicate.isComparison() || !reported.add(predicate.functor() + "/" + predicate.arity())) {
                return;
            }
            checkPredicate(rule, predicate, diagnostics);
        });
        for (Effect effect : rule.effects()) {
            if (!registry.isKnownAction(effect.action()) && reported.add("action:" + effect.action())) {
                diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.REFERENCE, rule.name(), null,
                        "Unknown action '" + effect.action() + "'"));
            }
        }
    }

    private void checkPredicate(Rule rule, Predicate predicate, List<Diagnostic> diagnostics) {
        String functor = predicate.functor();
        if (!registry.isKnownPredicate(functor)) {
            List<String> similar = registry.similarPredicates(functor);
            String message = "Unknown predicate '" + functor + "/" + predicate.arity() + "'";
            if (!similar.isEmpty()) {
                message += "; did you mean " + String.join(", ", similar) + "?";
            }
            diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.REFERENCE, rule.name(), null, message));
            return;
        }
        OptionalInt arity = registry.arityOf(functor);
        if (arity.isPresent() && arity.getAsInt() != predicate.arity()) {
            diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.REFERENCE, rule.name(), null,
                    "Predicate '" + functor + "' takes " + arity.getAsInt()
                            + " argument(s) but is used with " + predicate.arity()));
        }
    }
}
