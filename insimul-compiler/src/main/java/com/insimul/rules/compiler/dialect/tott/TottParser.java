/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.tott;

import com.insimul.rules.api.exceptions.RuleSyntaxException;
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
import com.insimul.rules.api.model.Term;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.dialect.AbstractBlockParser;
import com.insimul.rules.compiler.dialect.AbstractLexer;
import com.insimul.rules.compiler.dialect.Annotation;
import com.insimul.rules.compiler.dialect.Literals;
import com.insimul.rules.compiler.dialect.RuleBlock;
import com.insimul.rules.compiler.dialect.RuleFields;
import com.insimul.rules.compiler.dialect.Token;
import com.insimul.rules.compiler.dialect.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parser for Talk of the Town genealogy definitions:
 * <pre>
 * # &#64;likelihood 0.8
 * &#64;rule(priority=9, tags=["nobility"])
 * def noble_succession(heir, lord):
 *     if Person(heir) and parent_of(lord, heir):
 *         inherit_title(heir, lord.title)
 * </pre>
 * Blocks start at a column-one annotation, decorator or {@code def}; the
 * annotations and decorator ahead of a {@code def} belong to its block.
 */
public class TottParser extends AbstractBlockParser {

    static final Set<String> RESERVED = Set.of(
            "and", "or", "not", "if", "else", "elif", "def", "pass", "return", "in", "is",
            "True", "False", "None", "lambda", "for", "while", "class", "import", "from");

    @Override
    public Dialect dialect() {
        return Dialect.TOTT;
    }

    @Override
    protected AbstractLexer newLexer(String content) {
        return new TottLexer(content);
    }

    @Override
    protected List<RuleBlock> segment(List<Token> tokens, List<Diagnostic> diagnostics) {
        int eof = tokens.size() - 1;
        List<RuleBlock> blocks = new ArrayList<>();
        int start = -1;
        boolean hasDef = false;
        for (int i = 0; i < eof; i++) {
            Token token = tokens.get(i);
            boolean startsBlock = token.firstOnLine() && token.column() == 1
                    && (token.type() == Token.Type.ANNOTATION || token.isSymbol("@") || token.isWord("def"));
            if (!startsBlock) {
                continue;
            }
            if (start < 0) {
                reportStray(tokens, 0, i, diagnostics);
                start = i;
            } else if (hasDef) {
                blocks.add(RuleBlock.slice(tokens, start, i, nameHint(tokens, start, i)));
                start = i;
                hasDef = false;
            }
            if (token.isWord("def")) {
                hasDef = true;
            }
        }
        if (start < 0) {
            reportStray(tokens, 0, eof, diagnostics);
        } else if (hasDef || !onlyAnnotations(tokens, start, eof)) {
            blocks.add(RuleBlock.slice(tokens, start, eof, nameHint(tokens, start, eof)));
        }
        return blocks;
    }

    private static String nameHint(List<Token> tokens, int from, int to) {
        for (int i = from; i + 1 < to; i++) {
            if (tokens.get(i).isWord("def")) {
                return tokens.get(i + 1).text();
            }
        }
        return null;
    }

    private static boolean onlyAnnotations(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).type() != Token.Type.ANNOTATION) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Rule.Builder parseBlock(TokenStream in, List<Diagnostic> diagnostics) {
        List<Token> annotations = new ArrayList<>();
        while (in.check(Token.Type.ANNOTATION)) {
            annotations.add(in.next());
        }
        Rule.Builder builder = Rule.builder(null);
        List<Runnable> decorator = new ArrayList<>();
        String decoratedName = null;
        if (in.matchSymbol("@")) {
            in.expectWord("rule");
            decoratedName = parseDecorator(in, builder, diagnostics, decorator);
        }

        in.expectWord("def");
        Token defName = in.expect(Token.Type.WORD, "a function name");
        in.expectSymbol("(");
        if (!in.checkSymbol(")")) {
            do {
                in.expect(Token.Type.WORD, "a parameter name");
            } while (in.matchSymbol(","));
        }
        in.expectSymbol(")");
        in.expectSymbol(":");

        String name = decoratedName != null ? decoratedName : defName.text();
        if (name.isBlank()) {
            throw new RuleSyntaxException("Rule name cannot be empty", defName.position());
        }
        builder.name(name);
        decorator.forEach(Runnable::run);
        for (Token annotation : annotations) {
            applyAnnotation(Annotation.parse(annotation.text()), annotation, builder, diagnostics);
        }

        if (in.matchWord("if")) {
            builder.conditions(parseOr(in));
            in.expectSymbol(":");
        }
        if (in.matchWord("pass")) {
            in.expectEnd();
            return builder;
        }
        while (!in.atEnd()) {
            builder.effect(parseEffect(in));
        }
        return builder;
    }

    /**
     * Reads the decorator arguments. Field updates that may report diagnostics
     * are deferred until the rule name is known.
     *
     * @return the {@code name=} argument, or null
     */
    private String parseDecorator(TokenStream in, Rule.Builder builder, List<Diagnostic> diagnostics,
                                  List<Runnable> deferred) {
        String name = null;
        in.expectSymbol("(");
        while (!in.checkSymbol(")")) {
            Token key = in.expect(Token.Type.WORD, "a decorator argument");
            in.expectSymbol("=");
            switch (key.text()) {
                case "name" -> name = in.expect(Token.Type.STRING, "a quoted rule name").text();
                case "type" -> builder.ruleType(in.expect(Token.Type.STRING, "a quoted rule type").text());
                case "priority" -> {
                    Token value = in.expect(Token.Type.NUMBER, "a priority number");
                    deferred.add(() -> RuleFields.priority(builder, value.text(), value.position(), diagnostics));
                }
                case "tags" -> {
                    in.expectSymbol("[");
                    while (!in.checkSymbol("]")) {
                        Token tag = in.expect(Token.Type.STRING, "a quoted tag");
                        deferred.add(() -> RuleFields.tag(builder, tag.text(), tag.position(), diagnostics));
                        if (!in.matchSymbol(",")) {
                            break;
                        }
                    }
                    in.expectSymbol("]");
                }
                case "active" -> {
                    if (in.matchWord("True")) {
                        builder.active(true);
                    } else if (in.matchWord("False")) {
                        builder.active(false);
                    } else {
                        throw in.unexpected("True or False");
                    }
                }
                default -> throw new RuleSyntaxException(
                        "Unknown decorator argument '" + key.text() + "'", key.position());
            }
            if (!in.matchSymbol(",")) {
                break;
            }
        }
        in.expectSymbol(")");
        return name;
    }

    private static void applyAnnotation(Annotation annotation, Token token, Rule.Builder builder,
                                        List<Diagnostic> diagnostics) {
        switch (annotation.key()) {
            case "likelihood" -> RuleFields.likelihood(builder, annotation.value(), token.position(), diagnostics);
            case "depends" -> annotation.listValue().forEach(builder::dependency);
            default -> {
                // unrecognised annotations are ignored
            }
        }
    }

    private Effect parseEffect(TokenStream in) {
        EffectKind kind = null;
        Token first = in.peek();
        if (first.type() == Token.Type.WORD && isCallStart(in, 1)) {
            Optional<EffectKind> explicit = EffectKind.fromKeyword(first.text());
            if (explicit.isPresent()) {
                in.next();
                kind = explicit.get();
            }
        }
        if (!isCallStart(in, 0)) {
            throw in.unexpected("an effect call");
        }
        String action = in.next().text();
        return new Effect(action, parseArgs(in), kind);
    }

    private static boolean isCallStart(TokenStream in, int ahead) {
        Token name = in.peek(ahead);
        return (name.type() == Token.Type.WORD || name.type() == Token.Type.STRING)
                && in.peek(ahead + 1).isSymbol("(");
    }

    private List<Term> parseArgs(TokenStream in) {
        List<Term> args = new ArrayList<>();
        in.expectSymbol("(");
        if (in.matchSymbol(")")) {
            return args;
        }
        do {
            args.add(parseTerm(in));
        } while (in.matchSymbol(","));
        in.expectSymbol(")");
        return args;
    }

    private Condition parseOr(TokenStream in) {
        List<Condition> children = new ArrayList<>();
        children.add(parseAnd(in));
        while (in.matchWord("or")) {
            children.add(parseAnd(in));
        }
        return Condition.or(children);
    }

    private Condition parseAnd(TokenStream in) {
        List<Condition> children = new ArrayList<>();
        children.add(parseUnary(in));
        while (in.matchWord("and")) {
            children.add(parseUnary(in));
        }
        return Condition.and(children);
    }

    private Condition parseUnary(TokenStream in) {
        if (in.matchWord("not")) {
            return Condition.not(parseUnary(in));
        }
        return parsePrimary(in);
    }

    private Condition parsePrimary(TokenStream in) {
        if (in.matchSymbol("(")) {
            Condition inner = parseOr(in);
            in.expectSymbol(")");
            return inner;
        }
        if (isCallStart(in, 0)) {
            String functor = in.next().text();
            return new Predicate(functor, parseArgs(in));
        }
        if (!isOperator(in.peek(1))) {
            if (in.matchWord("True")) {
                return Condition.always();
            }
            if (in.matchWord("False")) {
                return new Or(List.of());
            }
        }
        Token start = in.peek();
        Term left = parseTerm(in);
        if (!isOperator(in.peek())) {
            throw new RuleSyntaxException("Expected a predicate call or comparison", start.position());
        }
        String operator = in.next().text();
        return Predicate.comparison(operator, left, parseTerm(in));
    }

    private static boolean isOperator(Token token) {
        return token.type() == Token.Type.SYMBOL && Predicate.COMPARISON_OPERATORS.contains(token.text());
    }

    private Term parseTerm(TokenStream in) {
        Token token = in.next();
        Term term = switch (token.type()) {
            case NUMBER -> Literals.number(token.text());
            case STRING -> new Constant(token.text());
            case WORD -> switch (token.text()) {
                case "True" -> new Constant(true);
                case "False" -> new Constant(false);
                default -> {
                    if (RESERVED.contains(token.text())) {
                        throw new RuleSyntaxException("'" + token.text() + "' cannot be used as a value",
                                token.position());
                    }
                    yield new Variable(variableName(token.text()));
                }
            };
            default -> throw new RuleSyntaxException("Expected a term but found " + token, token.position());
        };
        while (in.checkSymbol(".") && in.peek(1).type() == Token.Type.WORD) {
            in.next();
            term = new FieldAccess(term, in.next().text());
        }
        return term;
    }

    /**
     * Variables named after a reserved word are written with a trailing
     * underscore ({@code not_}); the mapping stays invertible for names that
     * already end in underscores.
     */
    static String variableName(String token) {
        return isEscaped(token) ? token.substring(0, token.length() - 1) : token;
    }

    static String variableToken(String name) {
        return RESERVED.contains(name) || isEscaped(name) ? name + "_" : name;
    }

    private static boolean isEscaped(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '_') {
            end--;
        }
        return end < s.length() && RESERVED.contains(s.substring(0, end));
    }
}
