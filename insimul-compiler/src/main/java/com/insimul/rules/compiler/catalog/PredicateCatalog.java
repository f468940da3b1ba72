/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insimul.rules.api.PredicateRegistry;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Predicates and actions known to the simulator, loaded from a JSON catalog:
 * <pre>
 * {
 *   "predicates": { "parent_of": { "arity": 2, "description": "..." } },
 *   "actions":    { "inherit_title": { "description": "..." } }
 * }
 * </pre>
 * A predicate without an {@code arity} accepts any number of arguments.
 */
public final class PredicateCatalog implements PredicateRegistry {
    private static final Logger logger = Logger.getLogger(PredicateCatalog.class.getName());

    public static final String DEFAULT_RESOURCE = "insimul-predicates.json";

    private static final int MAX_TYPO_DISTANCE = 2;
    private static final LevenshteinDistance TYPO_DISTANCE = new LevenshteinDistance(MAX_TYPO_DISTANCE);
    private static final int MAX_SUGGESTIONS = 5;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(@JsonProperty("arity") Integer arity, @JsonProperty("description") String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(@JsonProperty("predicates") Map<String, Entry> predicates,
                            @JsonProperty("actions") Map<String, Entry> actions) {
    }

    private final Map<String, Entry> predicates;
    private final Map<String, Entry> actions;

    public PredicateCatalog(Map<String, Entry> predicates, Map<String, Entry> actions) {
        this.predicates = Map.copyOf(predicates);
        this.actions = Map.copyOf(actions);
    }

    /**
     * Loads the catalog bundled on the classpath.
     */
    public static PredicateCatalog loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static PredicateCatalog loadResource(String resource) {
        try (InputStream in = PredicateCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Predicate catalog not found on classpath: " + resource);
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read predicate catalog " + resource, e);
        }
    }

    public static PredicateCatalog load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    private static PredicateCatalog read(InputStream in, String source) throws IOException {
        Document document = new ObjectMapper().readValue(in, Document.class);
        PredicateCatalog catalog = new PredicateCatalog(
                document.predicates() == null ? Map.of() : document.predicates(),
                document.actions() == null ? Map.of() : document.actions());
        logger.info(String.format("Loaded predicate catalog %s: %d predicates, %d actions",
                source, catalog.predicates.size(), catalog.actions.size()));
        return catalog;
    }

    @Override
    public boolean isKnownPredicate(String functor) {
        return predicates.containsKey(functor);
    }

    @Override
    public OptionalInt arityOf(String functor) {
        Entry entry = predicates.get(functor);
        return entry == null || entry.arity() == null ? OptionalInt.empty() : OptionalInt.of(entry.arity());
    }

    @Override
    public boolean isKnownAction(String action) {
        return actions.containsKey(action);
    }

    /**
     * Known predicates within a small edit distance of {@code functor}, nearest
     * first and then alphabetically. Matching ignores case.
     */
    @Override
    public List<String> similarPredicates(String functor) {
        String target = functor.toLowerCase(Locale.ROOT);
        Map<String, Integer> distances = new LinkedHashMap<>();
        for (String candidate : predicates.keySet()) {
            int distance = TYPO_DISTANCE.apply(target, candidate.toLowerCase(Locale.ROOT));
            if (distance > 0) {
                distances.put(candidate, distance);
            }
        }
        List<String> similar = new ArrayList<>(distances.keySet());
        similar.sort(Comparator.<String>comparingInt(distances::get).thenComparing(Comparator.naturalOrder()));
        return similar.size() > MAX_SUGGESTIONS ? similar.subList(0, MAX_SUGGESTIONS) : similar;
    }

    public int predicateCount() {
        return predicates.size();
    }

    public int actionCount() {
        return actions.size();
    }
}
