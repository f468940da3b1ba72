/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.exceptions.RuleSyntaxException;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.SourcePosition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Applies scalar rule fields read by any parser, reporting out-of-range values
 * and repeated tags while the source position is still known.
 */
public final class RuleFields {

    private static final BigDecimal MIN_PRIORITY = BigDecimal.valueOf(Rule.MIN_PRIORITY);
    private static final BigDecimal MAX_PRIORITY = BigDecimal.valueOf(Rule.MAX_PRIORITY);

    private RuleFields() {
    }

    /**
     * Reads a priority. Fractions are truncated and values outside the range are
     * clamped, each with a warning; only text that is not a number is an error.
     */
    public static void priority(Rule.Builder builder, String raw, SourcePosition position,
                                List<Diagnostic> diagnostics) {
        BigDecimal value;
        try {
            value = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new RuleSyntaxException("Priority must be a number, got '" + raw + "'", position);
        }
        BigDecimal whole = value.setScale(0, RoundingMode.DOWN);
        if (whole.compareTo(value) != 0) {
            diagnostics.add(Diagnostic.warning(Diagnostic.Category.RANGE, builder.name(), position,
                    "Priority " + value.toPlainString() + " is not a whole number and was truncated to "
                            + whole.toPlainString()));
        }
        int clamped = whole.max(MIN_PRIORITY).min(MAX_PRIORITY).intValueExact();
        if (whole.compareTo(BigDecimal.valueOf(clamped)) != 0) {
            diagnostics.add(Diagnostic.warning(Diagnostic.Category.RANGE, builder.name(), position,
                    "Priority " + whole.toPlainString() + " is outside " + Rule.MIN_PRIORITY + ".."
                            + Rule.MAX_PRIORITY + " and was clamped to " + clamped));
        }
        builder.priority(clamped);
    }

    public static void likelihood(Rule.Builder builder, String raw, SourcePosition position,
                                  List<Diagnostic> diagnostics) {
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new RuleSyntaxException("Likelihood must be a number, got '" + raw + "'", position);
        }
        if (Double.isNaN(value)) {
            throw new RuleSyntaxException("Likelihood must be a number, got '" + raw + "'", position);
        }
        double clamped = Rule.clampLikelihood(value);
        if (clamped != value) {
            diagnostics.add(Diagnostic.warning(Diagnostic.Category.RANGE, builder.name(), position,
                    "Likelihood " + value + " is outside 0..1 and was clamped to " + clamped));
        }
        builder.likelihood(clamped);
    }

    public static void tag(Rule.Builder builder, String tag, SourcePosition position,
                           List<Diagnostic> diagnostics) {
        if (builder.hasTag(tag)) {
            diagnostics.add(Diagnostic.suggestion(Diagnostic.Category.DUPLICATE, builder.name(), position,
                    "Tag '" + tag + "' is listed more than once"));
            return;
        }
        builder.tag(tag);
    }
}
