/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.prolog;

import com.insimul.rules.api.model.And;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.Not;
import com.insimul.rules.api.model.Or;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.AbstractTextEmitter;
import com.insimul.rules.compiler.dialect.ExampleBindings;
import com.insimul.rules.compiler.dialect.Literals;
import com.insimul.rules.compiler.dialect.kismet.KismetParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Writes rules as a consultable SWI-Prolog program. This is an export target
 * only: there is no parser for it and it is not one of the editable dialects.
 *
 * <p>Every predicate and action the rules mention is declared {@code dynamic} so
 * that the program loads before any facts are asserted. Each effect becomes a
 * clause whose body is the rule's conditions; a rule without effects becomes a
 * clause headed by its own name. Clauses of inactive rules are written commented
 * out.
 */
public class PrologEmitter extends AbstractTextEmitter {

    private static final Pattern ATOM = Pattern.compile("[a-z][A-Za-z0-9_]*");
    private static final Map<String, String> OPERATORS = Map.of("!=", "\\=", "<=", "=<");

    @Override
    protected String formatName() {
        return "SWI-Prolog";
    }

    @Override
    protected void renderPreamble(StringBuilder out, List<Rule> rules, boolean pretty) {
        Set<String> indicators = dynamicIndicators(rules);
        for (String indicator : indicators) {
            out.append(":- dynamic ").append(indicator).append(".\n");
        }
        if (!indicators.isEmpty() && !rules.isEmpty()) {
            out.append('\n');
        }
    }

    /**
     * Sorted {@code name/arity} indicators of every non-comparison predicate and
     * every effect action.
     */
    Set<String> dynamicIndicators(List<Rule> rules) {
        Set<String> indicators = new TreeSet<>();
        for (Rule rule : rules) {
            collect(rule.conditions(), indicators);
            for (Effect effect : rule.effects()) {
                indicators.add(functor(effect.action()) + "/" + effect.args().size());
            }
        }
        return indicators;
    }

    private void collect(Condition condition, Set<String> indicators) {
        if (condition instanceof Predicate p) {
            if (!p.isComparison()) {
                indicators.add(functor(p.functor()) + "/" + p.args().size());
            }
        } else if (condition instanceof And and) {
            and.children().forEach(child -> collect(child, indicators));
        } else if (condition instanceof Or or) {
            or.children().forEach(child -> collect(child, indicators));
        } else if (condition instanceof Not not) {
            collect(not.child(), indicators);
        }
    }

    @Override
    protected void renderRule(StringBuilder out, Rule rule, boolean pretty) {
        out.append("% ").append(ExampleBindings.singleLine(rule.name()))
                .append(" (").append(ExampleBindings.singleLine(rule.ruleType()))
                .append(", priority ").append(rule.priority())
                .append(", likelihood ").append(Literals.formatNumber(rule.likelihood()))
                .append(")\n");
        if (!rule.tags().isEmpty()) {
            out.append("% tags: ").append(ExampleBindings.singleLine(String.join(", ", rule.tags()))).append('\n');
        }
        if (!rule.dependencies().isEmpty()) {
            out.append("% depends: ").append(ExampleBindings.singleLine(String.join(", ", rule.dependencies())))
                    .append('\n');
        }

        List<String> heads = new ArrayList<>();
        for (Effect effect : rule.effects()) {
            heads.add(call(effect.action(), effect.args()));
        }
        if (heads.isEmpty()) {
            heads.add(functor(rule.name()));
        }
        String prefix = rule.active() ? "" : "% ";
        if (!rule.active()) {
            out.append("% inactive\n");
        }
        for (String head : heads) {
            out.append(prefix).append(head);
            if (!rule.conditions().isAlways()) {
                out.append(" :-").append(pretty ? "\n" + prefix + "    " : " ").append(condition(rule.conditions()));
            }
            out.append(".\n");
        }
    }

    @Override
    protected String call(String functor, List<Term> args) {
        return args.isEmpty() ? functor(functor) : super.call(functor, args);
    }

    @Override
    protected String commentPrefix() {
        return "% ";
    }

    @Override
    protected String variable(Variable variable) {
        return KismetParser.variableToken(variable.name());
    }

    @Override
    protected String string(String value) {
        return ATOM.matcher(value).matches() && !value.equals("true") && !value.equals("false")
                ? value : Literals.quote(value, '\'');
    }

    @Override
    protected String functor(String name) {
        return ATOM.matcher(name).matches() ? name : Literals.quote(name, '\'');
    }

    @Override
    protected String bool(boolean value) {
        return String.valueOf(value);
    }

    @Override
    protected String comparisonOperator(String operator) {
        return OPERATORS.getOrDefault(operator, operator);
    }

    @Override
    protected String andSeparator() {
        return ", ";
    }

    @Override
    protected String orSeparator() {
        return "; ";
    }

    @Override
    protected String notPrefix() {
        return "\\+ ";
    }

    @Override
    protected String trueLiteral() {
        return "true";
    }

    @Override
    protected String falseLiteral() {
        return "fail";
    }
}
