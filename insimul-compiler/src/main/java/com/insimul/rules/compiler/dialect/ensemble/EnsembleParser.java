/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.ensemble;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insimul.rules.api.DialectParser;
import com.insimul.rules.api.exceptions.RuleSyntaxException;
import com.insimul.rules.api.model.And;
import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.EffectKind;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Or;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.SourcePosition;
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.Literals;
import com.insimul.rules.compiler.dialect.RuleFields;
import com.insimul.rules.compiler.dialect.insimul.InsimulParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.insimul.rules.compiler.dialect.ensemble.EnsembleSchema.*;

/**
 * Parser for the Ensemble JSON rule format.
 *
 * <p>The document is walked with a streaming {@link JsonParser} so that each rule
 * entry keeps its line and column; every entry is then read as a tree and
 * converted on its own. A malformed entry costs only that rule. A JSON syntax
 * error, or anything after the top-level value, stops the walk but keeps the
 * entries read before it.
 *
 * <p>Accepted roots: an array of rules, {@code {"rules": [...]}}, or the sectioned
 * export with {@code triggerRules} and {@code volitionRules}. Content that does
 * not start like JSON is tried as legacy text rules
 * ({@code rule name { when (...) then { ... } }}), which share the Insimul block
 * syntax.
 */
public class EnsembleParser implements DialectParser {
    private static final Logger logger = Logger.getLogger(EnsembleParser.class.getName());

    private static final Map<String, String> SECTIONS = Map.of(
            TRIGGER_RULES, "trigger",
            VOLITION_RULES, "volition");

    private final ObjectMapper objectMapper;
    private final InsimulParser legacyTextParser = new InsimulParser();

    public EnsembleParser() {
        this(new ObjectMapper());
    }

    public EnsembleParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    private record Entry(JsonNode node, SourcePosition position, String sectionType) {
    }

    @Override
    public Dialect dialect() {
        return Dialect.ENSEMBLE;
    }

    @Override
    public CompilationResult parse(String content) {
        if (content == null || content.isBlank()) {
            return new CompilationResult(List.of(), List.of());
        }
        if (!startsLikeJson(content)) {
            CompilationResult legacy = parseLegacyText(content);
            if (legacy != null) {
                return legacy;
            }
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Entry> entries = new ArrayList<>();
        String fileType = null;
        try (JsonParser parser = objectMapper.createParser(content)) {
            JsonToken root = parser.nextToken();
            if (root == JsonToken.START_ARRAY) {
                readRuleArray(parser, null, entries);
            } else if (root == JsonToken.START_OBJECT) {
                fileType = readDocument(parser, entries, diagnostics);
            } else {
                diagnostics.add(Diagnostic.error(Diagnostic.Category.PARSE, null, position(parser.currentTokenLocation()),
                        "Expected a JSON object or array of rules"));
            }
            if (root == JsonToken.START_ARRAY || root == JsonToken.START_OBJECT) {
                if (parser.nextToken() != null) {
                    diagnostics.add(Diagnostic.error(Diagnostic.Category.PARSE, null,
                            position(parser.currentTokenLocation()),
                            "Unexpected content after the top-level JSON value"));
                }
            }
        } catch (JsonProcessingException e) {
            diagnostics.add(Diagnostic.error(Diagnostic.Category.PARSE, null, position(e.getLocation()),
                    "Invalid JSON: " + e.getOriginalMessage()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ensemble content", e);
        }

        List<Rule> rules = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            String defaultType = entry.sectionType() != null ? entry.sectionType() : fileType;
            List<Diagnostic> entryDiagnostics = new ArrayList<>();
            try {
                rules.add(toRule(entry.node(), defaultType, entry.position(), entryDiagnostics));
                diagnostics.addAll(entryDiagnostics);
            } catch (RuleSyntaxException e) {
                logger.log(Level.FINE, "Skipping malformed ensemble rule at {0}: {1}",
                        new Object[]{entry.position(), e.getMessage()});
                JsonNode name = entry.node().path(NAME);
                diagnostics.add(Diagnostic.error(Diagnostic.Category.PARSE,
                        name.isTextual() ? name.asText() : null, entry.position(),
                        "Malformed rule entry: " + e.getMessage()));
            }
        }
        return new CompilationResult(rules, diagnostics);
    }

    private static boolean startsLikeJson(String content) {
        String trimmed = content.stripLeading();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    /**
     * Reads legacy text rules. Returns null when the content holds no rule block
     * at all, so that it is reported as invalid JSON instead.
     */
    private CompilationResult parseLegacyText(String content) {
        CompilationResult result = legacyTextParser.parse(content);
        boolean sawRuleBlock = !result.rules().isEmpty()
                || result.diagnostics().stream().anyMatch(d -> d.ruleName() != null);
        if (!sawRuleBlock) {
            return null;
        }
        logger.log(Level.FINE, "Read {0} legacy ensemble text rule(s)", result.rules().size());
        List<Rule> rules = result.rules().stream()
                .map(rule -> rule.withSourceDialect(Dialect.ENSEMBLE))
                .toList();
        return new CompilationResult(rules, result.diagnostics());
    }

    private String readDocument(JsonParser parser, List<Entry> entries, List<Diagnostic> diagnostics)
            throws IOException {
        String fileType = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            JsonToken value = parser.nextToken();
            if (field.equals(RULES) && value == JsonToken.START_ARRAY) {
                readRuleArray(parser, null, entries);
            } else if (SECTIONS.containsKey(field) && value == JsonToken.START_OBJECT) {
                readSection(parser, SECTIONS.get(field), entries);
            } else if (field.equals(TYPE) && value == JsonToken.VALUE_STRING) {
                fileType = parser.getText();
            } else {
                if (!field.equals(FILE_NAME) && !field.startsWith("_")) {
                    diagnostics.add(Diagnostic.warning(Diagnostic.Category.STRUCTURE, null,
                            position(parser.currentTokenLocation()),
                            "Section '" + field + "' is not supported and was ignored"));
                }
                parser.skipChildren();
            }
        }
        return fileType;
    }

    private void readSection(JsonParser parser, String sectionType, List<Entry> entries) throws IOException {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            JsonToken value = parser.nextToken();
            if (field.equals(RULES) && value == JsonToken.START_ARRAY) {
                readRuleArray(parser, sectionType, entries);
            } else {
                parser.skipChildren();
            }
        }
    }

    private void readRuleArray(JsonParser parser, String sectionType, List<Entry> entries) throws IOException {
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            SourcePosition position = position(parser.currentTokenLocation());
            JsonNode node = objectMapper.readTree(parser);
            entries.add(new Entry(node, position, sectionType));
        }
    }

    private static SourcePosition position(JsonLocation location) {
        return location == null ? null : new SourcePosition(location.getLineNr(), location.getColumnNr());
    }

    private Rule toRule(JsonNode node, String defaultType, SourcePosition position, List<Diagnostic> diagnostics) {
        if (!node.isObject()) {
            throw new RuleSyntaxException("A rule entry must be a JSON object", position);
        }
        JsonNode name = node.path(NAME);
        if (!name.isTextual() || name.asText().isBlank()) {
            throw new RuleSyntaxException("A rule entry needs a non-empty \"name\"", position);
        }
        Rule.Builder builder = Rule.builder(name.asText()).sourceDialect(Dialect.ENSEMBLE);
        JsonNode type = node.path(TYPE);
        builder.ruleType(type.isTextual() ? type.asText() : defaultType);

        JsonNode weight = node.has(WEIGHT) ? node.get(WEIGHT) : node.get(PRIORITY);
        if (weight != null) {
            if (!weight.isNumber()) {
                throw new RuleSyntaxException("\"weight\" must be a number", position);
            }
            RuleFields.priority(builder, weight.asText(), position, diagnostics);
        }
        JsonNode likelihood = node.get(LIKELIHOOD);
        if (likelihood != null) {
            if (!likelihood.isNumber()) {
                throw new RuleSyntaxException("\"likelihood\" must be a number", position);
            }
            RuleFields.likelihood(builder, likelihood.asText(), position, diagnostics);
        }

        JsonNode conditions = node.get(CONDITIONS);
        if (conditions != null && !conditions.isNull()) {
            if (conditions.isArray()) {
                List<Condition> children = new ArrayList<>();
                conditions.forEach(child -> children.add(condition(child, position, diagnostics)));
                builder.conditions(Condition.and(children));
            } else {
                builder.conditions(condition(conditions, position, diagnostics));
            }
        }

        JsonNode effects = node.get(EFFECTS);
        if (effects != null && !effects.isNull()) {
            if (!effects.isArray()) {
                throw new RuleSyntaxException("\"effects\" must be an array", position);
            }
            effects.forEach(effect -> builder.effect(effect(effect, position, diagnostics)));
        }

        JsonNode meta = node.get(META);
        if (meta != null) {
            readMeta(meta, builder, position, diagnostics);
        }
        return builder.build();
    }

    private static void readMeta(JsonNode meta, Rule.Builder builder, SourcePosition position,
                                 List<Diagnostic> diagnostics) {
        if (!meta.isObject()) {
            throw new RuleSyntaxException("\"_meta\" must be an object", position);
        }
        for (JsonNode tag : stringArray(meta, TAGS, position)) {
            RuleFields.tag(builder, tag.asText(), position, diagnostics);
        }
        for (JsonNode dependency : stringArray(meta, DEPENDENCIES, position)) {
            builder.dependency(dependency.asText());
        }
        JsonNode active = meta.get(ACTIVE);
        if (active != null) {
            if (!active.isBoolean()) {
                throw new RuleSyntaxException("\"_meta.active\" must be true or false", position);
            }
            builder.active(active.asBoolean());
        }
    }

    private static List<JsonNode> stringArray(JsonNode parent, String field, SourcePosition position) {
        JsonNode array = parent.get(field);
        if (array == null) {
            return List.of();
        }
        List<JsonNode> items = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(items::add);
        }
        if (!array.isArray() || items.stream().anyMatch(item -> !item.isTextual())) {
            throw new RuleSyntaxException("\"" + field + "\" must be an array of strings", position);
        }
        return items;
    }

    private Condition condition(JsonNode node, SourcePosition position, List<Diagnostic> diagnostics) {
        if (!node.isObject()) {
            throw new RuleSyntaxException("A condition must be a JSON object, got " + node, position);
        }
        if (node.has(AND)) {
            return new And(children(node.get(AND), position, diagnostics));
        }
        if (node.has(OR)) {
            return new Or(children(node.get(OR), position, diagnostics));
        }
        if (node.has(NOT)) {
            return Condition.not(condition(node.get(NOT), position, diagnostics));
        }
        if (node.has(OPERATOR) && !node.has(CATEGORY)) {
            String operator = node.get(OPERATOR).asText();
            if (!Predicate.COMPARISON_OPERATORS.contains(operator)) {
                throw new RuleSyntaxException("Unknown comparison operator '" + operator + "'", position);
            }
            List<Term> args = args(node, position);
            if (args.size() != 2) {
                throw new RuleSyntaxException("A comparison needs \"first\" and \"second\"", position);
            }
            return Predicate.comparison(operator, args.get(0), args.get(1));
        }
        if (node.has(PREDICATE)) {
            String functor = node.get(PREDICATE).asText();
            if (functor.isEmpty()) {
                throw new RuleSyntaxException("\"predicate\" cannot be empty", position);
            }
            return new Predicate(functor, args(node, position));
        }
        if (node.has(CATEGORY)) {
            return legacyPredicate(node, position, diagnostics);
        }
        throw new RuleSyntaxException("Unrecognised condition " + node, position);
    }

    private List<Condition> children(JsonNode array, SourcePosition position, List<Diagnostic> diagnostics) {
        if (!array.isArray()) {
            throw new RuleSyntaxException("\"and\"/\"or\" must hold an array of conditions", position);
        }
        List<Condition> children = new ArrayList<>();
        array.forEach(child -> children.add(condition(child, position, diagnostics)));
        return children;
    }

    /**
     * Reads the original Ensemble shape {@code {category, type, first, second,
     * value, operator}} as the predicate {@code category_type(first, second, value)}.
     */
    private Predicate legacyPredicate(JsonNode node, SourcePosition position, List<Diagnostic> diagnostics) {
        String functor = node.path(CATEGORY).asText() + "_" + node.path(TYPE).asText();
        List<Term> args = args(node, position);
        JsonNode value = node.get(VALUE);
        if (value != null) {
            args.add(value.isTextual() ? new Constant(value.asText()) : term(value, position));
        }
        JsonNode operator = node.get(OPERATOR);
        if (operator != null && !operator.asText().equals("=")) {
            diagnostics.add(Diagnostic.warning(Diagnostic.Category.CONVERSION, null, position,
                    "Operator '" + operator.asText() + "' of legacy condition " + functor + " was dropped"));
        }
        return new Predicate(functor, args);
    }

    private Effect effect(JsonNode node, SourcePosition position, List<Diagnostic> diagnostics) {
        if (!node.isObject()) {
            throw new RuleSyntaxException("An effect must be a JSON object, got " + node, position);
        }
        String action;
        if (node.has(ACTION)) {
            action = node.get(ACTION).asText();
        } else if (node.has(CATEGORY)) {
            action = node.path(CATEGORY).asText() + "_" + node.path(TYPE).asText();
        } else {
            throw new RuleSyntaxException("An effect needs an \"action\"", position);
        }
        if (action.isEmpty()) {
            throw new RuleSyntaxException("\"action\" cannot be empty", position);
        }
        EffectKind kind = null;
        JsonNode kindNode = node.get(KIND);
        if (kindNode != null) {
            kind = EffectKind.fromKeyword(kindNode.asText()).orElseThrow(() ->
                    new RuleSyntaxException("Unknown effect kind '" + kindNode.asText() + "'", position));
        }
        List<Term> args = args(node, position);
        if (!node.has(ACTION) && node.has(VALUE)) {
            JsonNode value = node.get(VALUE);
            args.add(value.isTextual() ? new Constant(value.asText()) : term(value, position));
        }
        return new Effect(action, args, kind);
    }

    private List<Term> args(JsonNode node, SourcePosition position) {
        List<Term> args = new ArrayList<>();
        if (node.has(ARGS)) {
            JsonNode array = node.get(ARGS);
            if (!array.isArray()) {
                throw new RuleSyntaxException("\"args\" must be an array", position);
            }
            array.forEach(arg -> args.add(term(arg, position)));
            return args;
        }
        if (node.has(FIRST)) {
            args.add(term(node.get(FIRST), position));
        }
        if (node.has(SECOND)) {
            if (args.isEmpty()) {
                throw new RuleSyntaxException("\"second\" given without \"first\"", position);
            }
            args.add(term(node.get(SECOND), position));
        }
        return args;
    }

    private Term term(JsonNode node, SourcePosition position) {
        if (node.isTextual()) {
            return rolePath(node.asText(), position);
        }
        if (node.isBoolean()) {
            return new Constant(node.asBoolean());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new Constant(node.asLong());
        }
        if (node.isNumber()) {
            return new Constant(node.asDouble());
        }
        if (node.isObject() && node.has(VALUE)) {
            JsonNode value = node.get(VALUE);
            return value.isTextual() ? new Constant(value.asText()) : literal(value, position);
        }
        if (node.isObject() && node.has(ROLE) && node.get(ROLE).isTextual()) {
            return new Variable(node.get(ROLE).asText());
        }
        if (node.isObject() && node.has(OF) && node.path(FIELD).isTextual()) {
            return new FieldAccess(term(node.get(OF), position), node.get(FIELD).asText());
        }
        throw new RuleSyntaxException("Unrecognised argument " + node, position);
    }

    private Term literal(JsonNode value, SourcePosition position) {
        if (value.isBoolean() || value.isNumber()) {
            return term(value, position);
        }
        throw new RuleSyntaxException("\"value\" must be a string, number or boolean", position);
    }

    private static Term rolePath(String path, SourcePosition position) {
        String[] parts = path.split("\\.", -1);
        for (String part : parts) {
            if (!Literals.isIdentifier(part)) {
                throw new RuleSyntaxException("Invalid role reference '" + path
                        + "'; wrap literal strings as {\"value\": ...}", position);
            }
        }
        Term term = new Variable(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            term = new FieldAccess(term, parts[i]);
        }
        return term;
    }
}
