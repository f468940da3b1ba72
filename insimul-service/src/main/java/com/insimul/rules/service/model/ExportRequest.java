/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.model;

import com.insimul.rules.api.model.NameBinding;
import com.insimul.rules.api.model.Rule;

import java.util.List;

/**
 * Canonical rules to render. Unset flags fall back to the service defaults.
 */
public record ExportRequest(
        List<Rule> rules,
        String dialect,
        Boolean prettyPrint,
        Boolean includeComments,
        List<NameBinding> bindings
) {
}
