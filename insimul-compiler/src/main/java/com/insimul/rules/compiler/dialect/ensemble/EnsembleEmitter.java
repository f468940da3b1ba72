/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.ensemble;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.insimul.rules.api.DialectEmitter;
import com.insimul.rules.api.model.And;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Not;
import com.insimul.rules.api.model.Or;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.ExampleBindings;

import java.util.List;
import java.util.Map;

import static com.insimul.rules.compiler.dialect.ensemble.EnsembleSchema.*;

/**
 * Writes rules as an Ensemble JSON document. Tags, dependencies and the active
 * flag have no Ensemble field and go into the {@code _meta} object of each rule.
 */
public class EnsembleEmitter implements DialectEmitter {

    static final String DEFAULT_FILE_NAME = "insimul-rules";

    private final ObjectMapper objectMapper;

    public EnsembleEmitter() {
        this(new ObjectMapper());
    }

    public EnsembleEmitter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Dialect dialect() {
        return Dialect.ENSEMBLE;
    }

    @Override
    public String render(List<Rule> rules, RenderOptions options) {
        ObjectNode document = objectMapper.createObjectNode();
        if (options.includeComments()) {
            document.put(COMMENT, "ensemble rules (" + rules.size() + ")");
        }
        document.put(FILE_NAME, DEFAULT_FILE_NAME);
        ArrayNode array = document.putArray(RULES);
        for (Rule rule : rules) {
            array.add(rule(rule, options));
        }
        try {
            return options.prettyPrint()
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write ensemble JSON", e);
        }
    }

    private ObjectNode rule(Rule rule, RenderOptions options) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(NAME, rule.name());
        node.put(TYPE, rule.ruleType());
        node.put(WEIGHT, rule.priority());
        node.put(LIKELIHOOD, rule.likelihood());

        ArrayNode conditions = node.putArray(CONDITIONS);
        Condition root = rule.conditions();
        if (root instanceof And and) {
            and.children().forEach(child -> conditions.add(condition(child)));
        } else {
            conditions.add(condition(root));
        }

        ArrayNode effects = node.putArray(EFFECTS);
        rule.effects().forEach(effect -> effects.add(effect(effect)));

        ObjectNode meta = objectMapper.createObjectNode();
        if (!rule.tags().isEmpty()) {
            ArrayNode tags = meta.putArray(TAGS);
            rule.tags().forEach(tags::add);
        }
        if (!rule.dependencies().isEmpty()) {
            ArrayNode dependencies = meta.putArray(DEPENDENCIES);
            rule.dependencies().forEach(dependencies::add);
        }
        if (!rule.active()) {
            meta.put(ACTIVE, false);
        }
        if (!meta.isEmpty()) {
            node.set(META, meta);
        }

        Map<Variable, String> examples = ExampleBindings.assign(rule, options.bindings());
        if (!examples.isEmpty()) {
            ObjectNode example = node.putObject(EXAMPLE);
            examples.forEach((variable, name) -> example.put(variable.name(), name));
        }
        return node;
    }

    private ObjectNode condition(Condition condition) {
        ObjectNode node = objectMapper.createObjectNode();
        if (condition instanceof Predicate p) {
            if (p.isComparison()) {
                node.put(OPERATOR, p.functor());
            } else {
                node.put(PREDICATE, p.functor());
            }
            putArgs(node, p.args());
        } else if (condition instanceof And and) {
            ArrayNode children = node.putArray(AND);
            and.children().forEach(child -> children.add(condition(child)));
        } else if (condition instanceof Or or) {
            ArrayNode children = node.putArray(OR);
            or.children().forEach(child -> children.add(condition(child)));
        } else {
            node.set(NOT, condition(((Not) condition).child()));
        }
        return node;
    }

    private ObjectNode effect(Effect effect) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(ACTION, effect.action());
        node.put(KIND, effect.kind().keyword());
        putArgs(node, effect.args());
        return node;
    }

    private void putArgs(ObjectNode node, List<Term> args) {
        if (args.size() > 2) {
            ArrayNode array = node.putArray(ARGS);
            args.forEach(arg -> array.add(term(arg)));
            return;
        }
        if (!args.isEmpty()) {
            node.set(FIRST, term(args.get(0)));
        }
        if (args.size() == 2) {
            node.set(SECOND, term(args.get(1)));
        }
    }

    private JsonNode term(Term term) {
        String path = rolePath(term);
        if (path != null) {
            return objectMapper.getNodeFactory().textNode(path);
        }
        if (term instanceof Variable v) {
            return objectMapper.createObjectNode().put(ROLE, v.name());
        }
        if (term instanceof FieldAccess f) {
            ObjectNode node = objectMapper.createObjectNode();
            node.set(OF, term(f.target()));
            node.put(FIELD, f.field());
            return node;
        }
        Object value = ((Constant) term).value();
        if (value instanceof String s) {
            return objectMapper.createObjectNode().put(VALUE, s);
        }
        if (value instanceof Boolean b) {
            return objectMapper.getNodeFactory().booleanNode(b);
        }
        if (value instanceof Long l) {
            return objectMapper.getNodeFactory().numberNode(l);
        }
        return objectMapper.getNodeFactory().numberNode((Double) value);
    }
}
