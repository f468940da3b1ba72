/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A literal value: a string (quoted text and bare atoms alike), a whole number,
 * a decimal number or a boolean.
 *
 * <p>Integer and float inputs are widened to {@link Long} and {@link Double} so
 * that structurally equal constants are also {@code equals}.
 */
public record Constant(@JsonProperty("value") Object value) implements Term {

    public Constant {
        Objects.requireNonNull(value, "Constant value cannot be null");
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            value = ((Number) value).longValue();
        } else if (value instanceof Float) {
            value = ((Float) value).doubleValue();
        }
        if (!(value instanceof String || value instanceof Long
                || value instanceof Double || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
    }

    @JsonIgnore
    public boolean isString() {
        return value instanceof String;
    }

    @JsonIgnore
    public boolean isNumber() {
        return value instanceof Long || value instanceof Double;
    }

    @JsonIgnore
    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
