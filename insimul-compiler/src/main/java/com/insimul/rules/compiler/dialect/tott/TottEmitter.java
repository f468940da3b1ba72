/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.tott;

import com.insimul.rules.api.DialectEmitter;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.AbstractTextEmitter;
import com.insimul.rules.compiler.dialect.Annotation;
import com.insimul.rules.compiler.dialect.ExampleBindings;
import com.insimul.rules.compiler.dialect.Literals;

import java.util.StringJoiner;

/**
 * Writes rules as Talk of the Town definitions. The decorator carries rule type,
 * priority, tags and the active flag; likelihood and dependencies travel in
 * {@code # @key} annotations.
 */
public class TottEmitter extends AbstractTextEmitter implements DialectEmitter {

    @Override
    public Dialect dialect() {
        return Dialect.TOTT;
    }

    @Override
    protected String formatName() {
        return dialect().tag();
    }

    @Override
    protected void renderRule(StringBuilder out, Rule rule, boolean pretty) {
        out.append("# @likelihood ").append(Literals.formatNumber(rule.likelihood())).append('\n');
        if (!rule.dependencies().isEmpty()) {
            out.append("# @depends ").append(Annotation.formatList(rule.dependencies())).append('\n');
        }

        boolean plainName = isPlainIdentifier(rule.name());
        StringJoiner decorator = new StringJoiner(", ", "@rule(", ")");
        if (!plainName) {
            decorator.add("name=" + Literals.quote(rule.name(), '"'));
        }
        if (!Rule.DEFAULT_RULE_TYPE.equals(rule.ruleType())) {
            decorator.add("type=" + Literals.quote(rule.ruleType(), '"'));
        }
        decorator.add("priority=" + rule.priority());
        if (!rule.tags().isEmpty()) {
            StringJoiner tags = new StringJoiner(", ", "[", "]");
            rule.tags().forEach(tag -> tags.add(Literals.quote(tag, '"')));
            decorator.add("tags=" + tags);
        }
        if (!rule.active()) {
            decorator.add("active=False");
        }
        out.append(decorator).append('\n');

        StringJoiner params = new StringJoiner(", ", "(", ")");
        ExampleBindings.variablesOf(rule).forEach(v -> params.add(variable(v)));
        out.append("def ").append(plainName ? rule.name() : functionName(rule.name())).append(params).append(":\n");

        String indent = "    ";
        if (!rule.conditions().isAlways()) {
            out.append(indent).append("if ").append(condition(rule.conditions())).append(":\n");
            indent = "        ";
        }
        if (rule.effects().isEmpty()) {
            out.append(indent).append("pass\n");
        }
        for (Effect effect : rule.effects()) {
            out.append(indent).append(effect(effect)).append('\n');
        }
    }

    private static boolean isPlainIdentifier(String name) {
        return Literals.isIdentifier(name) && !TottParser.RESERVED.contains(name);
    }

    private static String functionName(String name) {
        String sanitized = name.replaceAll("[^A-Za-z0-9_]", "_");
        return isPlainIdentifier(sanitized) ? sanitized : "rule_" + sanitized;
    }

    @Override
    protected String commentPrefix() {
        return "# ";
    }

    @Override
    protected String variable(Variable variable) {
        return TottParser.variableToken(variable.name());
    }

    @Override
    protected String string(String value) {
        return Literals.quote(value, '"');
    }

    @Override
    protected String functor(String name) {
        return isPlainIdentifier(name) ? name : Literals.quote(name, '"');
    }

    @Override
    protected String bool(boolean value) {
        return value ? "True" : "False";
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
        return "True";
    }

    @Override
    protected String falseLiteral() {
        return "False";
    }
}
