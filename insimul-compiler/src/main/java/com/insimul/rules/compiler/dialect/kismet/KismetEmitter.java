/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.kismet;

import com.insimul.rules.api.DialectEmitter;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.AbstractTextEmitter;
import com.insimul.rules.compiler.dialect.Annotation;
import com.insimul.rules.compiler.dialect.Literals;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes rules as Kismet trait declarations. Likelihood has native syntax; the
 * priority and every other non-native field go into {@code % @key} annotations.
 */
public class KismetEmitter extends AbstractTextEmitter implements DialectEmitter {

    private static final Pattern ATOM = Pattern.compile("[a-z][A-Za-z0-9_]*");
    private static final Map<String, String> OPERATORS = Map.of("!=", "\\=", "<=", "=<");

    @Override
    public Dialect dialect() {
        return Dialect.KISMET;
    }

    @Override
    protected String formatName() {
        return dialect().tag();
    }

    @Override
    protected void renderRule(StringBuilder out, Rule rule, boolean pretty) {
        String keyword = switch (rule.ruleType()) {
            case "trait", "pattern", "volition" -> rule.ruleType();
            case KismetParser.DEFAULT_TRAIT -> "default trait";
            default -> {
                out.append("% @type ").append(rule.ruleType()).append('\n');
                yield "trait";
            }
        };
        out.append("% @priority ").append(rule.priority()).append('\n');
        if (!rule.tags().isEmpty()) {
            out.append("% @tags ").append(Annotation.formatList(rule.tags())).append('\n');
        }
        if (!rule.dependencies().isEmpty()) {
            out.append("% @depends ").append(Annotation.formatList(rule.dependencies())).append('\n');
        }
        if (!rule.active()) {
            out.append("% @active false\n");
        }

        out.append(keyword).append(' ').append(atom(rule.name())).append(':');
        String separator = pretty ? ",\n    " : ", ";
        for (int i = 0; i < rule.effects().size(); i++) {
            out.append(i == 0 ? (pretty ? "\n    " : " ") : separator).append(effect(rule.effects().get(i)));
        }
        if (!rule.conditions().isAlways()) {
            out.append(pretty ? "\n    " : " ").append(":- ").append(condition(rule.conditions()));
        }
        out.append(".\n");
        out.append("likelihood: ").append(Literals.formatNumber(rule.likelihood())).append('\n');
    }

    private static String atom(String value) {
        return ATOM.matcher(value).matches() ? value : Literals.quote(value, '\'');
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
        return value.equals("true") || value.equals("false") ? Literals.quote(value, '\'') : atom(value);
    }

    @Override
    protected String functor(String name) {
        return atom(name);
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
        return "false";
    }
}
