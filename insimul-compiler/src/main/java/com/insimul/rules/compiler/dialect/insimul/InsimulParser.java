/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect.insimul;

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
import com.insimul.rules.compiler.dialect.Literals;
import com.insimul.rules.compiler.dialect.RuleBlock;
import com.insimul.rules.compiler.dialect.RuleFields;
import com.insimul.rules.compiler.dialect.Token;
import com.insimul.rules.compiler.dialect.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parser for the Insimul block syntax:
 * <pre>
 * rule noble_succession {
 *   when (Person(?heir) and Noble(?lord) and parent_of(?lord, ?heir))
 *   then {
 *     inherit_title(?heir, ?lord.title)
 *   }
 *   priority: 9
 *   tags: [nobility, inheritance]
 * }
 * </pre>
 * A block starts at a header made of the rule type, the rule name and an opening
 * brace. The header must begin a line or sit outside every brace, so parsing
 * resumes at the next rule after an unbalanced block.
 */
public class InsimulParser extends AbstractBlockParser {

    @Override
    public Dialect dialect() {
        return Dialect.INSIMUL;
    }

    @Override
    protected AbstractLexer newLexer(String content) {
        return new InsimulLexer(content);
    }

    @Override
    protected List<RuleBlock> segment(List<Token> tokens, List<Diagnostic> diagnostics) {
        int eof = tokens.size() - 1;
        List<Integer> starts = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < eof; i++) {
            Token token = tokens.get(i);
            if (isHeader(tokens, i) && (depth == 0 || token.firstOnLine())) {
                starts.add(i);
                depth = 0;
            }
            if (token.isSymbol("{")) {
                depth++;
            } else if (token.isSymbol("}")) {
                depth = Math.max(0, depth - 1);
            }
        }
        reportStray(tokens, 0, starts.isEmpty() ? eof : starts.get(0), diagnostics);

        List<RuleBlock> blocks = new ArrayList<>(starts.size());
        for (int k = 0; k < starts.size(); k++) {
            int from = starts.get(k);
            int to = k + 1 < starts.size() ? starts.get(k + 1) : eof;
            blocks.add(RuleBlock.slice(tokens, from, to, tokens.get(from + 1).text()));
        }
        return blocks;
    }

    private static boolean isHeader(List<Token> tokens, int i) {
        return i + 2 < tokens.size()
                && tokens.get(i).type() == Token.Type.WORD
                && (tokens.get(i + 1).type() == Token.Type.WORD || tokens.get(i + 1).type() == Token.Type.STRING)
                && tokens.get(i + 2).isSymbol("{");
    }

    @Override
    protected Rule.Builder parseBlock(TokenStream in, List<Diagnostic> diagnostics) {
        String ruleType = in.expect(Token.Type.WORD, "rule type").text();
        Token name = in.next();
        if (name.text().isBlank()) {
            throw new RuleSyntaxException("Rule name cannot be empty", name.position());
        }
        Rule.Builder builder = Rule.builder(name.text()).ruleType(ruleType);
        in.expectSymbol("{");

        boolean seenWhen = false;
        boolean seenThen = false;
        while (!in.checkSymbol("}")) {
            if (in.atEnd()) {
                throw in.error("Rule block is not closed, missing '}'");
            }
            Token key = in.peek();
            if (in.matchWord("when")) {
                if (seenWhen) {
                    throw new RuleSyntaxException("Duplicate 'when' clause", key.position());
                }
                seenWhen = true;
                builder.conditions(parseOr(in));
            } else if (in.matchWord("then")) {
                if (seenThen) {
                    throw new RuleSyntaxException("Duplicate 'then' clause", key.position());
                }
                seenThen = true;
                parseEffects(in, builder);
            } else if (key.type() == Token.Type.WORD) {
                in.next();
                in.expectSymbol(":");
                parseProperty(key, in, builder, diagnostics);
            } else {
                throw in.unexpected("a rule clause");
            }
            if (!in.matchSymbol(";")) {
                in.matchSymbol(",");
            }
        }
        in.expectSymbol("}");
        in.expectEnd();
        return builder;
    }

    private void parseProperty(Token key, TokenStream in, Rule.Builder builder, List<Diagnostic> diagnostics) {
        switch (key.text()) {
            case "priority" -> {
                Token value = in.expect(Token.Type.NUMBER, "a priority number");
                RuleFields.priority(builder, value.text(), value.position(), diagnostics);
            }
            case "likelihood" -> {
                Token value = in.expect(Token.Type.NUMBER, "a likelihood number");
                RuleFields.likelihood(builder, value.text(), value.position(), diagnostics);
            }
            case "tags" -> {
                for (Token tag : parseList(in)) {
                    RuleFields.tag(builder, tag.text(), tag.position(), diagnostics);
                }
            }
            case "dependencies", "depends_on" -> parseList(in).forEach(dep -> builder.dependency(dep.text()));
            case "active" -> {
                if (in.matchWord("true")) {
                    builder.active(true);
                } else if (in.matchWord("false")) {
                    builder.active(false);
                } else {
                    throw in.unexpected("true or false");
                }
            }
            case "type" -> {
                Token value = in.next();
                if (value.type() != Token.Type.STRING && value.type() != Token.Type.WORD) {
                    throw new RuleSyntaxException("Expected a rule type", value.position());
                }
                builder.ruleType(value.text());
            }
            default -> throw new RuleSyntaxException(
                    "Unknown rule property '" + key.text() + "'", key.position());
        }
    }

    private static List<Token> parseList(TokenStream in) {
        List<Token> items = new ArrayList<>();
        in.expectSymbol("[");
        while (!in.checkSymbol("]")) {
            Token item = in.next();
            if (item.type() != Token.Type.WORD && item.type() != Token.Type.STRING && item.type() != Token.Type.NUMBER) {
                throw new RuleSyntaxException("Expected a list item but found " + item, item.position());
            }
            items.add(item);
            if (!in.matchSymbol(",")) {
                break;
            }
        }
        in.expectSymbol("]");
        return items;
    }

    private void parseEffects(TokenStream in, Rule.Builder builder) {
        in.expectSymbol("{");
        while (!in.checkSymbol("}")) {
            if (in.atEnd()) {
                throw in.error("Effect list is not closed, missing '}'");
            }
            builder.effect(parseEffect(in));
            if (!in.matchSymbol(";")) {
                in.matchSymbol(",");
            }
        }
        in.expectSymbol("}");
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
            String operator = in.next().text();
            return Predicate.comparison(operator, left, parseTerm(in));
        }
        if (start.type() == Token.Type.WORD && left instanceof Constant) {
            return new Predicate(start.text(), List.of());
        }
        throw new RuleSyntaxException("Expected a predicate or comparison", start.position());
    }

    private static boolean isOperator(Token token) {
        return token.type() == Token.Type.SYMBOL && Predicate.COMPARISON_OPERATORS.contains(token.text());
    }

    private Term parseTerm(TokenStream in) {
        Token token = in.next();
        Term term = switch (token.type()) {
            case VARIABLE -> new Variable(token.text());
            case NUMBER -> Literals.number(token.text());
            case STRING -> new Constant(token.text());
            case WORD -> switch (token.text()) {
                case "true" -> new Constant(true);
                case "false" -> new Constant(false);
                default -> new Constant(token.text());
            };
            default -> throw new RuleSyntaxException(
                    "Expected a term but found " + token, token.position());
        };
        while (in.checkSymbol(".") && in.peek(1).type() == Token.Type.WORD) {
            in.next();
            term = new FieldAccess(term, in.next().text());
        }
        return term;
    }
}
