/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.ensemble;

import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.Literals;

/**
 * JSON field names of the Ensemble rule format and the role-path spelling of
 * variables ({@code "lord.title"}).
 */
final class EnsembleSchema {

    static final String RULES = "rules";
    static final String TRIGGER_RULES = "triggerRules";
    static final String VOLITION_RULES = "volitionRules";
    static final String FILE_NAME = "fileName";
    static final String COMMENT = "_comment";

    static final String NAME = "name";
    static final String TYPE = "type";
    static final String WEIGHT = "weight";
    static final String PRIORITY = "priority";
    static final String LIKELIHOOD = "likelihood";
    static final String CONDITIONS = "conditions";
    static final String EFFECTS = "effects";
    static final String META = "_meta";
    static final String EXAMPLE = "_example";

    static final String TAGS = "tags";
    static final String DEPENDENCIES = "dependencies";
    static final String ACTIVE = "active";

    static final String PREDICATE = "predicate";
    static final String OPERATOR = "operator";
    static final String AND = "and";
    static final String OR = "or";
    static final String NOT = "not";
    static final String ACTION = "action";
    static final String KIND = "kind";
    static final String FIRST = "first";
    static final String SECOND = "second";
    static final String ARGS = "args";
    static final String VALUE = "value";
    static final String ROLE = "role";
    static final String OF = "of";
    static final String FIELD = "field";

    static final String CATEGORY = "category";

    private EnsembleSchema() {
    }

    /**
     * The {@code role.field.field} spelling of a term, or null when the term is
     * not a variable or a field chain rooted at one.
     */
    static String rolePath(Term term) {
        if (term instanceof Variable v) {
            return Literals.isIdentifier(v.name()) ? v.name() : null;
        }
        if (term instanceof FieldAccess f && Literals.isIdentifier(f.field())) {
            String target = rolePath(f.target());
            return target == null ? null : target + "." + f.field();
        }
        return null;
    }
}
