/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.model.And;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.NameBinding;
import com.insimul.rules.api.model.Not;
import com.insimul.rules.api.model.Or;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs the variables of a rule with example entity names for the illustrative
 * comments emitters may add. Purely cosmetic: parsers never read these back.
 */
public final class ExampleBindings {

    private ExampleBindings() {
    }

    /**
     * Variables of a rule in order of first appearance, conditions before effects.
     */
    public static Set<Variable> variablesOf(Rule rule) {
        Set<Variable> variables = new LinkedHashSet<>();
        collect(rule.conditions(), variables);
        for (Effect effect : rule.effects()) {
            effect.args().forEach(arg -> collect(arg, variables));
        }
        return variables;
    }

    /**
     * Assigns bindings to variables round-robin. Empty when there are no bindings
     * or no variables. Names are flattened to a single line so that they cannot
     * end the comment they are written into.
     */
    public static Map<Variable, String> assign(Rule rule, List<NameBinding> bindings) {
        Map<Variable, String> assigned = new LinkedHashMap<>();
        if (bindings == null || bindings.isEmpty()) {
            return assigned;
        }
        int i = 0;
        for (Variable variable : variablesOf(rule)) {
            assigned.put(variable, singleLine(bindings.get(i++ % bindings.size()).name()));
        }
        return assigned;
    }

    public static String singleLine(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean lineBreak = Character.isISOControl(c) || c == '\u2028' || c == '\u2029';
            sb.append(lineBreak ? ' ' : c);
        }
        return sb.toString();
    }

    private static void collect(Condition condition, Set<Variable> out) {
        if (condition instanceof Predicate p) {
            p.args().forEach(arg -> collect(arg, out));
        } else if (condition instanceof And and) {
            and.children().forEach(child -> collect(child, out));
        } else if (condition instanceof Or or) {
            or.children().forEach(child -> collect(child, out));
        } else if (condition instanceof Not not) {
            collect(not.child(), out);
        }
    }

    private static void collect(Term term, Set<Variable> out) {
        if (term instanceof Variable v) {
            out.add(v);
        } else if (term instanceof FieldAccess f) {
            collect(f.target(), out);
        }
    }
}
