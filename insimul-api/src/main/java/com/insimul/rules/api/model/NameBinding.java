/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

/**
 * A character from the author's world whose name may illustrate exported examples.
 */
public record NameBinding(String id, String name) {
}
