/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Key/value metadata carried in comments by dialects that lack native syntax for
 * a rule field, e.g. {@code % @tags nobility, "royal court"}.
 */
public record Annotation(String key, String value) {

    private static final Pattern BARE_ITEM = Pattern.compile("[A-Za-z0-9_.:/-]+");

    /**
     * Splits annotation token text ({@code "tags a, b"}) into key and value.
     */
    public static Annotation parse(String text) {
        String trimmed = text.strip();
        int space = 0;
        while (space < trimmed.length() && !Character.isWhitespace(trimmed.charAt(space))) {
            space++;
        }
        return new Annotation(trimmed.substring(0, space), trimmed.substring(space).strip());
    }

    public static String formatList(Iterable<String> items) {
        StringBuilder sb = new StringBuilder();
        for (String item : items) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(BARE_ITEM.matcher(item).matches() ? item : Literals.quote(item, '"'));
        }
        return sb.toString();
    }

    /**
     * Reads a comma separated list of bare or double-quoted items.
     */
    public List<String> listValue() {
        List<String> items = new ArrayList<>();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == ',' || Character.isWhitespace(c)) {
                i++;
            } else if (c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < value.length() && value.charAt(i) != '"') {
                    char ch = value.charAt(i++);
                    if (ch == '\\' && i < value.length()) {
                        char escaped = value.charAt(i++);
                        sb.append(switch (escaped) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            case 'r' -> '\r';
                            default -> escaped;
                        });
                    } else {
                        sb.append(ch);
                    }
                }
                i++;
                items.add(sb.toString());
            } else {
                int end = value.indexOf(',', i);
                if (end < 0) {
                    end = value.length();
                }
                String item = value.substring(i, end).strip();
                if (!item.isEmpty()) {
                    items.add(item);
                }
                i = end;
            }
        }
        return items;
    }
}
