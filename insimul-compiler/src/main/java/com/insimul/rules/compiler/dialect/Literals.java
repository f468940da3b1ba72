/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.model.Constant;

import java.util.regex.Pattern;

/**
 * Literal spelling helpers common to the text dialects.
 */
public final class Literals {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Literals() {
    }

    public static boolean isIdentifier(String s) {
        return s != null && IDENTIFIER.matcher(s).matches();
    }

    public static String quote(String s, char quote) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Parses a lexed number as a {@code Long} when integral, otherwise a {@code Double}.
     */
    public static Constant number(String text) {
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return new Constant(Long.parseLong(text));
            } catch (NumberFormatException e) {
                // too large for a long, fall through
            }
        }
        return new Constant(Double.parseDouble(text));
    }

    /**
     * Renders a numeric constant so that {@link #number(String)} reads back the same type.
     */
    public static String formatNumber(Object value) {
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new IllegalArgumentException("Non-finite number cannot be rendered: " + d);
            }
            return Double.toString(d);
        }
        return String.valueOf(value);
    }
}
