/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.model;

import com.insimul.rules.api.model.Dialect;

public record ExportResponse(Dialect dialect, int ruleCount, String content) {
}
