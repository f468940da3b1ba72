/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import java.util.List;

/**
 * Options for rendering rules into a dialect.
 *
 * @param prettyPrint     one element per line with indentation; otherwise compact
 * @param includeComments write a header comment naming the dialect and rule count
 * @param bindings        character names used only in example comments; never
 *                        change the logical content that is emitted
 */
public record RenderOptions(boolean prettyPrint, boolean includeComments, List<NameBinding> bindings) {

    public static final RenderOptions DEFAULT = new RenderOptions(true, false, List.of());

    public RenderOptions {
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }

    public static RenderOptions compact() {
        return new RenderOptions(false, false, List.of());
    }

    public RenderOptions withBindings(List<NameBinding> bindings) {
        return new RenderOptions(prettyPrint, includeComments, bindings);
    }
}
