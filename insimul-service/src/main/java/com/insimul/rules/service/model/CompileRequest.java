/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.model;

/**
 * Source text to parse, tagged with the dialect it is written in.
 */
public record CompileRequest(String content, String dialect) {
}
