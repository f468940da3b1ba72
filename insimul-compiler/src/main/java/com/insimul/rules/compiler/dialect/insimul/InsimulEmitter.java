/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.insimul;

import com.insimul.rules.api.DialectEmitter;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.AbstractTextEmitter;
import com.insimul.rules.compiler.dialect.Literals;

import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Writes rules in the Insimul block syntax. Every rule field has native syntax
 * here, so no annotations are needed.
 */
public class InsimulEmitter extends AbstractTextEmitter implements DialectEmitter {

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(-[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Set<String> RESERVED_ATOMS = Set.of("true", "false", "and", "or", "not");

    @Override
    public Dialect dialect() {
        return Dialect.INSIMUL;
    }

    @Override
    protected String formatName() {
        return dialect().tag();
    }

    @Override
    protected void renderRule(StringBuilder out, Rule rule, boolean pretty) {
        String indent = pretty ? "\n  " : " ";
        boolean plainType = WORD.matcher(rule.ruleType()).matches();
        out.append(plainType ? headerKeyword(rule.ruleType()) : "rule").append(' ')
                .append(word(rule.name())).append(" {");

        if (!rule.conditions().isAlways()) {
            out.append(indent).append("when (").append(condition(rule.conditions())).append(')');
        }
        if (!rule.effects().isEmpty()) {
            out.append(indent).append("then {");
            for (int i = 0; i < rule.effects().size(); i++) {
                Effect effect = rule.effects().get(i);
                if (pretty) {
                    out.append("\n    ");
                } else {
                    out.append(i == 0 ? " " : "; ");
                }
                out.append(effect(effect));
            }
            out.append(pretty ? "\n  }" : " }");
        }
        if (!plainType) {
            out.append(indent).append("type: ").append(Literals.quote(rule.ruleType(), '"'));
        }
        out.append(indent).append("priority: ").append(rule.priority());
        out.append(indent).append("likelihood: ").append(Literals.formatNumber(rule.likelihood()));
        if (!rule.tags().isEmpty()) {
            out.append(indent).append("tags: ").append(list(rule.tags()));
        }
        if (!rule.dependencies().isEmpty()) {
            out.append(indent).append("dependencies: ").append(list(rule.dependencies()));
        }
        if (!rule.active()) {
            out.append(indent).append("active: false");
        }
        out.append(pretty ? "\n}\n" : " }\n");
    }

    private static String headerKeyword(String ruleType) {
        return Rule.DEFAULT_RULE_TYPE.equals(ruleType) ? "rule" : ruleType;
    }

    private static String word(String value) {
        return WORD.matcher(value).matches() ? value : Literals.quote(value, '"');
    }

    private static String list(Iterable<String> items) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        items.forEach(item -> joiner.add(word(item)));
        return joiner.toString();
    }

    @Override
    protected String commentPrefix() {
        return "// ";
    }

    @Override
    protected String variable(Variable variable) {
        return "?" + variable.name();
    }

    @Override
    protected String string(String value) {
        return WORD.matcher(value).matches() && !RESERVED_ATOMS.contains(value)
                ? value
                : Literals.quote(value, '"');
    }

    @Override
    protected String functor(String name) {
        return word(name);
    }

    @Override
    protected String bool(boolean value) {
        return String.valueOf(value);
    }

    @Override
    protected String andSeparator() {
        return " and ";
    }

    @Override
    protected String orSeparator() {
        return " or ";
    }

    @Override
    protected String notPrefix() {
        return "not ";
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
