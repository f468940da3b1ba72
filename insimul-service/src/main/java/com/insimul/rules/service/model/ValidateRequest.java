/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.model;

import com.insimul.rules.api.model.Rule;

import java.util.List;

/**
 * Either source text with its dialect, or already-parsed rules. Text wins when
 * both are present.
 */
public record ValidateRequest(String content, String dialect, List<Rule> rules) {
}
