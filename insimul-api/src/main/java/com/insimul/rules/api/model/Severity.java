/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How serious a diagnostic is. Only {@link #ERROR} makes a rule set invalid.
 */
public enum Severity {
    ERROR,
    WARNING,
    SUGGESTION;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
