/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.model.And;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Not;
import com.insimul.rules.api.model.Or;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Skeleton for the text emitters. Subclasses supply the spelling of variables,
 * atoms and connectives; this class takes care of precedence so that every
 * nested {@code and}/{@code or} is parenthesized and re-parses to the same tree.
 *
 * <p>Dialect emitters also implement {@link com.insimul.rules.api.DialectEmitter};
 * render-only targets such as SWI-Prolog extend this class alone.
 */
public abstract class AbstractTextEmitter {

    public String render(List<Rule> rules, RenderOptions options) {
        StringBuilder out = new StringBuilder();
        if (options.includeComments()) {
            out.append(commentPrefix()).append(headerComment(rules.size())).append('\n');
            if (options.prettyPrint()) {
                out.append('\n');
            }
        }
        renderPreamble(out, rules, options.prettyPrint());
        for (int i = 0; i < rules.size(); i++) {
            if (i > 0 && options.prettyPrint()) {
                out.append('\n');
            }
            Rule rule = rules.get(i);
            Map<Variable, String> examples = ExampleBindings.assign(rule, options.bindings());
            if (!examples.isEmpty()) {
                StringJoiner joiner = new StringJoiner(", ", commentPrefix() + "example: ", "\n");
                examples.forEach((variable, name) -> joiner.add(variable(variable) + " = " + name));
                out.append(joiner);
            }
            renderRule(out, rule, options.prettyPrint());
        }
        return out.toString();
    }

    /**
     * Appends one rule, ending with a newline.
     */
    protected abstract void renderRule(StringBuilder out, Rule rule, boolean pretty);

    /**
     * Appends anything the document needs ahead of its first rule.
     */
    protected void renderPreamble(StringBuilder out, List<Rule> rules, boolean pretty) {
    }

    protected abstract String commentPrefix();

    /**
     * Name of the output format, used in the header comment.
     */
    protected abstract String formatName();

    protected String headerComment(int ruleCount) {
        return formatName() + " rules (" + ruleCount + ")";
    }

    protected abstract String variable(Variable variable);

    /**
     * Spells a string constant, bare when the dialect reads it back as the same atom.
     */
    protected abstract String string(String value);

    /**
     * Spells a predicate functor or effect action.
     */
    protected abstract String functor(String name);

    protected abstract String bool(boolean value);

    protected abstract String andSeparator();

    protected abstract String orSeparator();

    protected abstract String notPrefix();

    protected abstract String trueLiteral();

    protected abstract String falseLiteral();

    protected String comparisonOperator(String operator) {
        return operator;
    }

    protected String term(Term term) {
        if (term instanceof Variable v) {
            return variable(v);
        }
        if (term instanceof FieldAccess f) {
            return term(f.target()) + "." + f.field();
        }
        Constant constant = (Constant) term;
        if (constant.isString()) {
            return string((String) constant.value());
        }
        if (constant.isBoolean()) {
            return bool((Boolean) constant.value());
        }
        return Literals.formatNumber(constant.value());
    }

    protected String call(String functor, List<Term> args) {
        StringJoiner joiner = new StringJoiner(", ", functor(functor) + "(", ")");
        args.forEach(arg -> joiner.add(term(arg)));
        return joiner.toString();
    }

    protected String condition(Condition condition) {
        if (condition instanceof Predicate p) {
            if (p.isComparison()) {
                return term(p.args().get(0)) + " " + comparisonOperator(p.functor()) + " " + term(p.args().get(1));
            }
            return call(p.functor(), p.args());
        }
        if (condition instanceof And and) {
            return and.children().isEmpty() ? trueLiteral() : join(and.children(), andSeparator());
        }
        if (condition instanceof Or or) {
            return or.children().isEmpty() ? falseLiteral() : join(or.children(), orSeparator());
        }
        Condition child = ((Not) condition).child();
        return notPrefix() + (isPlainCall(child) ? condition(child) : "(" + condition(child) + ")");
    }

    private String join(List<Condition> children, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (Condition child : children) {
            joiner.add(isCompound(child) ? "(" + condition(child) + ")" : condition(child));
        }
        return joiner.toString();
    }

    private static boolean isCompound(Condition condition) {
        return (condition instanceof And and && !and.children().isEmpty())
                || (condition instanceof Or or && !or.children().isEmpty());
    }

    private static boolean isPlainCall(Condition condition) {
        return condition instanceof Predicate p && !p.isComparison();
    }

    /**
     * Renders an effect, writing the kind keyword only when it differs from the
     * kind conventionally implied by the action name.
     */
    protected String effect(Effect effect) {
        String call = call(effect.action(), effect.args());
        return effect.hasExplicitKind() ? effect.kind().keyword() + " " + call : call;
    }
}
