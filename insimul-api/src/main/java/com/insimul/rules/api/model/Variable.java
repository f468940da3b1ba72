/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A logic variable, named without any dialect sigil or capitalization.
 */
public record Variable(@JsonProperty("name") String name) implements Term {

    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
    }

    @Override
    public Variable rootVariable() {
        return this;
    }

    @Override
    public String toString() {
        return "?" + name;
    }
}
