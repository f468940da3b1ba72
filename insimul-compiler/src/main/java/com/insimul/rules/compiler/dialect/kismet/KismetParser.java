/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.kismet;

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
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parser for Kismet trait declarations:
 * <pre>
 * % &#64;priority 9
 * trait noble_succession:
 *     inherit_title(Heir, Lord.title)
 *     :- person(Heir), noble(Lord), parent_of(Lord, Heir).
 * likelihood: 0.8
 * </pre>
 * Effects form the clause head and the condition its body. Fields without
 * Kismet syntax arrive as {@code % @key value} annotations ahead of the header.
 */
public class KismetParser extends AbstractBlockParser {

    static final Set<String> HEADER_KEYWORDS = Set.of("trait", "pattern", "volition");
    static final String DEFAULT_TRAIT = "default-trait";

    private static final Map<String, String> OPERATORS = Map.of(
            "==", "==", "\\=", "!=", "<", "<", "=<", "<=", ">", ">", ">=", ">=");

    @Override
    public Dialect dialect() {
        return Dialect.KISMET;
    }

    @Override
    protected AbstractLexer newLexer(String content) {
        return new KismetLexer(content);
    }

    /**
     * A block runs from the end of the previous one to the first clause-ending
     * period outside parentheses, plus a trailing {@code likelihood:} line. A
     * header or annotation starting a line after the block's own header also
     * closes it, so a missing period costs only that rule.
     */
    @Override
    protected List<RuleBlock> segment(List<Token> tokens, List<Diagnostic> diagnostics) {
        int eof = tokens.size() - 1;
        List<RuleBlock> blocks = new ArrayList<>();
        int start = 0;
        while (start < eof) {
            int depth = 0;
            int headerAt = -1;
            int i = start;
            for (; i < eof; i++) {
                Token token = tokens.get(i);
                if (headerAt >= 0 && i > headerAt && token.firstOnLine()
                        && (token.type() == Token.Type.ANNOTATION || headerLength(tokens, i) > 0)) {
                    break;
                }
                if (headerAt < 0 && headerLength(tokens, i) > 0) {
                    headerAt = i;
                }
                if (token.isSymbol("(")) {
                    depth++;
                } else if (token.isSymbol(")")) {
                    depth = Math.max(0, depth - 1);
                } else if (token.type() == Token.Type.TERMINATOR && depth == 0) {
                    i = afterLikelihood(tokens, i + 1);
                    break;
                }
            }
            int end = Math.min(i, eof);
            if (!onlyAnnotations(tokens, start, end)) {
                String nameHint = headerAt >= 0 ? tokens.get(headerAt + headerLength(tokens, headerAt) - 2).text() : null;
                blocks.add(RuleBlock.slice(tokens, start, end, nameHint));
            }
            start = end;
        }
        return blocks;
    }

    /**
     * Number of tokens in a header ({@code trait name :}) starting at {@code i}, or 0.
     */
    static int headerLength(List<Token> tokens, int i) {
        int offset = 0;
        if (tokens.get(i).isWord("default") && i + 1 < tokens.size() && tokens.get(i + 1).isWord("trait")) {
            offset = 1;
        } else if (tokens.get(i).type() != Token.Type.WORD || !HEADER_KEYWORDS.contains(tokens.get(i).text())) {
            return 0;
        }
        int name = i + offset + 1;
        if (name + 1 >= tokens.size()) {
            return 0;
        }
        Token.Type nameType = tokens.get(name).type();
        boolean validName = nameType == Token.Type.WORD || nameType == Token.Type.STRING || nameType == Token.Type.VARIABLE;
        return validName && tokens.get(name + 1).isSymbol(":") ? offset + 3 : 0;
    }

    private static int afterLikelihood(List<Token> tokens, int i) {
        if (i + 2 < tokens.size()
                && tokens.get(i).isWord("likelihood")
                && tokens.get(i + 1).isSymbol(":")
                && tokens.get(i + 2).type() == Token.Type.NUMBER) {
            i += 3;
            if (tokens.get(i).type() == Token.Type.TERMINATOR) {
                i++;
            }
        }
        return i;
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

        String ruleType;
        if (in.matchWord("default")) {
            in.expectWord("trait");
            ruleType = DEFAULT_TRAIT;
        } else {
            Token keyword = in.expect(Token.Type.WORD, "trait, pattern or volition");
            if (!HEADER_KEYWORDS.contains(keyword.text())) {
                throw new RuleSyntaxException("Unknown declaration '" + keyword.text() + "'", keyword.position());
            }
            ruleType = keyword.text();
        }
        Token name = in.next();
        if (name.type() != Token.Type.WORD && name.type() != Token.Type.STRING && name.type() != Token.Type.VARIABLE) {
            throw new RuleSyntaxException("Expected a trait name but found " + name, name.position());
        }
        if (name.text().isBlank()) {
            throw new RuleSyntaxException("Rule name cannot be empty", name.position());
        }
        in.expectSymbol(":");
        Rule.Builder builder = Rule.builder(name.text()).ruleType(ruleType);
        for (Token annotation : annotations) {
            applyAnnotation(Annotation.parse(annotation.text()), annotation, builder, diagnostics);
        }

        if (!in.checkSymbol(":-") && !in.check(Token.Type.TERMINATOR)) {
            do {
                builder.effect(parseEffect(in));
            } while (in.matchSymbol(","));
        }
        if (in.matchSymbol(":-")) {
            builder.conditions(parseOr(in));
        }
        in.expect(Token.Type.TERMINATOR, "'.' ending the clause");

        if (in.matchWord("likelihood")) {
            in.expectSymbol(":");
            Token value = in.expect(Token.Type.NUMBER, "a likelihood number");
            RuleFields.likelihood(builder, value.text(), value.position(), diagnostics);
            if (in.check(Token.Type.TERMINATOR)) {
                in.next();
            }
        }
        in.expectEnd();
        return builder;
    }

    private static void applyAnnotation(Annotation annotation, Token token, Rule.Builder builder,
                                        List<Diagnostic> diagnostics) {
        switch (annotation.key()) {
            case "priority" -> RuleFields.priority(builder, annotation.value(), token.position(), diagnostics);
            case "type" -> builder.ruleType(annotation.value());
            case "tags" -> annotation.listValue().forEach(tag -> RuleFields.tag(builder, tag, token.position(), diagnostics));
            case "depends" -> annotation.listValue().forEach(builder::dependency);
            case "active" -> builder.active(!annotation.value().equalsIgnoreCase("false"));
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
        return (name.type() == Token.Type.WORD || name.type() == Token.Type.STRING || name.type() == Token.Type.VARIABLE)
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
        while (in.matchSymbol(";")) {
            children.add(parseAnd(in));
        }
        return Condition.or(children);
    }

    private Condition parseAnd(TokenStream in) {
        List<Condition> children = new ArrayList<>();
        children.add(parseUnary(in));
        while (in.matchSymbol(",")) {
            children.add(parseUnary(in));
        }
        return Condition.and(children);
    }

    private Condition parseUnary(TokenStream in) {
        if (in.matchSymbol("\\+")) {
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
            if (in.matchWord("true")) {
                return Condition.always();
            }
            if (in.matchWord("false")) {
                return new Or(List.of());
            }
        }
        Token start = in.peek();
        Term left = parseTerm(in);
        if (isOperator(in.peek())) {
            String operator = OPERATORS.get(in.next().text());
            return Predicate.comparison(operator, left, parseTerm(in));
        }
        if (start.type() == Token.Type.WORD && left instanceof Constant) {
            return new Predicate(start.text(), List.of());
        }
        throw new RuleSyntaxException("Expected a goal or comparison", start.position());
    }

    private static boolean isOperator(Token token) {
        return token.type() == Token.Type.SYMBOL && OPERATORS.containsKey(token.text());
    }

    private Term parseTerm(TokenStream in) {
        Token token = in.next();
        Term term = switch (token.type()) {
            case VARIABLE -> new Variable(variableName(token.text()));
            case NUMBER -> Literals.number(token.text());
            case STRING -> new Constant(token.text());
            case WORD -> switch (token.text()) {
                case "true" -> new Constant(true);
                case "false" -> new Constant(false);
                default -> new Constant(token.text());
            };
            default -> throw new RuleSyntaxException("Expected a term but found " + token, token.position());
        };
        while (in.checkSymbol(".")) {
            in.next();
            Token field = in.next();
            if (field.type() != Token.Type.WORD && field.type() != Token.Type.VARIABLE) {
                throw new RuleSyntaxException("Expected a field name but found " + field, field.position());
            }
            term = new FieldAccess(term, field.text());
        }
        return term;
    }

    /**
     * Maps a Kismet variable to its canonical name: {@code Heir} is {@code heir},
     * and a leading underscore escapes a name that does not start with a lower
     * case letter ({@code _Heir} is {@code Heir}).
     */
    static String variableName(String token) {
        if (token.length() > 1 && token.charAt(0) == '_') {
            return token.substring(1);
        }
        if (token.equals("_")) {
            return token;
        }
        return Character.toLowerCase(token.charAt(0)) + token.substring(1);
    }

    /**
     * Inverse of {@link #variableName(String)}.
     */
    public static String variableToken(String name) {
        char first = name.charAt(0);
        if (first >= 'a' && first <= 'z') {
            return Character.toUpperCase(first) + name.substring(1);
        }
        return "_" + name;
    }
}
