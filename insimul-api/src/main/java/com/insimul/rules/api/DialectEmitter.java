/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api;

import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;

import java.util.List;

/**
 * Renders canonical rules as one surface syntax.
 *
 * <p>Output must round-trip: parsing it with the same dialect's parser yields
 * rules with the same logical content. Fields the dialect cannot express
 * natively are written as annotations its parser reads back.
 */
public interface DialectEmitter {

    /**
     * The dialect this emitter writes.
     */
    Dialect dialect();

    /**
     * Renders the rules as one document.
     */
    String render(List<Rule> rules, RenderOptions options);

    /**
     * Renders a single rule, as cached per rule and dialect.
     */
    default String render(Rule rule, RenderOptions options) {
        return render(List.of(rule), options);
    }
}
