/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The document after an explicit dialect switch.
 *
 * <p>When the switch fails closed, {@code content} and {@code dialect} are the
 * originals, {@code converted} is false and {@code warning} explains why nothing
 * was converted. A successful switch may still carry a warning, e.g. when some
 * blocks of the source could not be parsed and were left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DialectSwitchResult(String content, Dialect dialect, boolean converted, Diagnostic warning) {

    public static DialectSwitchResult converted(String content, Dialect dialect, Diagnostic warning) {
        return new DialectSwitchResult(content, dialect, true, warning);
    }

    public static DialectSwitchResult unchanged(String content, Dialect dialect, Diagnostic warning) {
        return new DialectSwitchResult(content, dialect, false, warning);
    }
}
