/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.registry;

import com.insimul.rules.api.model.Rule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The canonical rules of one editing session, keyed by name in insertion order.
 *
 * <p>Not thread-safe; each session owns its own instance.
 */
public class RuleRegistry {

    private final Map<String, Rule> rules = new LinkedHashMap<>();

    /**
     * Adds or replaces the rule with the same name, keeping the original position
     * of a replaced rule.
     *
     * @return the rule that was replaced, if any
     */
    public Optional<Rule> add(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        return Optional.ofNullable(rules.put(rule.name(), rule));
    }

    /**
     * Adds every rule; later rules replace earlier ones with the same name.
     *
     * @return names of the rules that replaced an existing entry
     */
    public List<String> addAll(Collection<Rule> incoming) {
        List<String> replaced = new ArrayList<>();
        for (Rule rule : incoming) {
            if (add(rule).isPresent()) {
                replaced.add(rule.name());
            }
        }
        return replaced;
    }

    public Optional<Rule> findByName(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public Optional<Rule> remove(String name) {
        return Optional.ofNullable(rules.remove(name));
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    public List<Rule> findByTag(String tag) {
        return rules.values().stream().filter(rule -> rule.tags().contains(tag)).toList();
    }

    public List<Rule> findByType(String ruleType) {
        return rules.values().stream().filter(rule -> rule.ruleType().equals(ruleType)).toList();
    }

    public List<Rule> all() {
        return List.copyOf(rules.values());
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public void clear() {
        rules.clear();
    }

    public DependencyGraph dependencyGraph() {
        return DependencyGraph.of(rules.values());
    }

    /**
     * Rules ordered so that each follows its dependencies.
     *
     * @throws com.insimul.rules.api.exceptions.DependencyCycleException when the
     *         dependencies form a cycle
     */
    public List<Rule> inDependencyOrder() {
        return dependencyGraph().topologicalOrder().stream().map(rules::get).toList();
    }
}
