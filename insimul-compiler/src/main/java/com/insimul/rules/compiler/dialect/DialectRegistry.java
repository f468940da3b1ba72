/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.dialect;

import com.insimul.rules.api.DialectEmitter;
import com.insimul.rules.api.DialectParser;
import com.insimul.rules.api.exceptions.UnknownDialectException;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.compiler.dialect.ensemble.EnsembleEmitter;
import com.insimul.rules.compiler.dialect.ensemble.EnsembleParser;
import com.insimul.rules.compiler.dialect.insimul.InsimulEmitter;
import com.insimul.rules.compiler.dialect.insimul.InsimulParser;
import com.insimul.rules.compiler.dialect.kismet.KismetEmitter;
import com.insimul.rules.compiler.dialect.kismet.KismetParser;
import com.insimul.rules.compiler.dialect.tott.TottEmitter;
import com.insimul.rules.compiler.dialect.tott.TottParser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Parser and emitter per dialect. Registration is meant to happen once at start
 * up; lookups are safe from any thread afterwards.
 */
public final class DialectRegistry {

    private final Map<Dialect, DialectParser> parsers = new EnumMap<>(Dialect.class);
    private final Map<Dialect, DialectEmitter> emitters = new EnumMap<>(Dialect.class);

    /**
     * A registry holding the four built-in dialects.
     */
    public static DialectRegistry defaults() {
        return new DialectRegistry()
                .register(new InsimulParser(), new InsimulEmitter())
                .register(new EnsembleParser(), new EnsembleEmitter())
                .register(new KismetParser(), new KismetEmitter())
                .register(new TottParser(), new TottEmitter());
    }

    public DialectRegistry register(DialectParser parser, DialectEmitter emitter) {
        if (parser.dialect() != emitter.dialect()) {
            throw new IllegalArgumentException("Parser for " + parser.dialect()
                    + " cannot be paired with emitter for " + emitter.dialect());
        }
        parsers.put(parser.dialect(), parser);
        emitters.put(emitter.dialect(), emitter);
        return this;
    }

    public DialectParser parser(Dialect dialect) {
        DialectParser parser = parsers.get(dialect);
        if (parser == null) {
            throw new UnknownDialectException(String.valueOf(dialect));
        }
        return parser;
    }

    public DialectEmitter emitter(Dialect dialect) {
        DialectEmitter emitter = emitters.get(dialect);
        if (emitter == null) {
            throw new UnknownDialectException(String.valueOf(dialect));
        }
        return emitter;
    }

    public Set<Dialect> supportedDialects() {
        return Collections.unmodifiableSet(parsers.keySet());
    }
}
