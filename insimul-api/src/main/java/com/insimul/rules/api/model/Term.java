/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An argument of a predicate call or an effect.
 *
 * <p>A term is a {@link Variable}, a {@link Constant} or a {@link FieldAccess}
 * such as {@code ?lord.title}. How each kind is spelled is a lexical rule of the
 * individual dialect.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Variable.class, name = "variable"),
        @JsonSubTypes.Type(value = Constant.class, name = "constant"),
        @JsonSubTypes.Type(value = FieldAccess.class, name = "field")
})
public interface Term {

    static Variable variable(String name) {
        return new Variable(name);
    }

    static Constant constant(Object value) {
        return new Constant(value);
    }

    static FieldAccess field(Term target, String field) {
        return new FieldAccess(target, field);
    }

    /**
     * Returns the variable this term ultimately refers to, or {@code null} for a
     * constant or a field access on a constant.
     */
    default Variable rootVariable() {
        return null;
    }
}
