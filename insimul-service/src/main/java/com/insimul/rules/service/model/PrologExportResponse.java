/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.model;

/**
 * SWI-Prolog rendering of a rule set. {@code format} is always {@value #FORMAT}.
 */
public record PrologExportResponse(String format, int ruleCount, String content) {

    public static final String FORMAT = "swi-prolog";

    public static PrologExportResponse of(int ruleCount, String content) {
        return new PrologExportResponse(FORMAT, ruleCount, content);
    }
}
