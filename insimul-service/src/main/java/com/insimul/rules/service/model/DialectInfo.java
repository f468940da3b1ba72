/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.model;

import com.insimul.rules.api.model.Dialect;

public record DialectInfo(String tag, String name) {

    public static DialectInfo of(Dialect dialect) {
        return new DialectInfo(dialect.tag(), dialect.name());
    }
}
