/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.registry;

import com.insimul.rules.api.exceptions.DependencyCycleException;
import com.insimul.rules.api.model.Rule;
import it.unimi.dsi.fastutil.objects.Object2ByteMap;
import it.unimi.dsi.fastutil.objects.Object2ByteOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of rule dependencies, where an edge {@code a -> b} means rule
 * {@code a} depends on rule {@code b}.
 *
 * <p>Cycle search is a depth-first walk with three node states (unvisited, on
 * the current path, finished). Each back edge found reports the cycle it closes
 * along the current path. A cycle reachable only through nodes already finished
 * is not reported again, so overlapping cycles may share one report. Nodes and
 * edges are visited in insertion order, which makes the result deterministic.
 */
public final class DependencyGraph {

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    private DependencyGraph() {
    }

    /**
     * Builds the graph of the given rules. When several rules share a name, the
     * first one wins.
     */
    public static DependencyGraph of(Collection<Rule> rules) {
        DependencyGraph graph = new DependencyGraph();
        for (Rule rule : rules) {
            graph.edges.putIfAbsent(rule.name(), new LinkedHashSet<>(rule.dependencies()));
        }
        return graph;
    }

    public Set<String> nodes() {
        return edges.keySet();
    }

    public Set<String> dependenciesOf(String name) {
        return edges.getOrDefault(name, Set.of());
    }

    /**
     * Rules that depend directly on {@code name}.
     */
    public List<String> dependentsOf(String name) {
        List<String> dependents = new ArrayList<>();
        edges.forEach((node, targets) -> {
            if (targets.contains(name)) {
                dependents.add(node);
            }
        });
        return dependents;
    }

    /**
     * Dependencies naming no rule in the graph, keyed by the rule that names them.
     */
    public Map<String, List<String>> missingDependencies() {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        edges.forEach((node, targets) -> {
            for (String target : targets) {
                if (!edges.containsKey(target)) {
                    missing.computeIfAbsent(node, k -> new ArrayList<>()).add(target);
                }
            }
        });
        return missing;
    }

    /**
     * One cycle per back edge found, each as its nodes in traversal order:
     * {@code [a, b]} for {@code a -> b -> a}, and {@code [a]} for a rule
     * depending on itself.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Object2ByteMap<String> state = new Object2ByteOpenHashMap<>(edges.size());
        state.defaultReturnValue(UNVISITED);
        List<String> path = new ArrayList<>();
        for (String node : edges.keySet()) {
            if (state.getByte(node) == UNVISITED) {
                visit(node, state, path, cycles, null);
            }
        }
        return cycles;
    }

    /**
     * Orders rules so that every rule comes after its dependencies. Missing
     * dependencies are ignored.
     *
     * @throws DependencyCycleException on the first cycle found
     */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>(edges.size());
        Object2ByteMap<String> state = new Object2ByteOpenHashMap<>(edges.size());
        state.defaultReturnValue(UNVISITED);
        List<List<String>> cycles = new ArrayList<>();
        List<String> path = new ArrayList<>();
        for (String node : edges.keySet()) {
            if (state.getByte(node) == UNVISITED) {
                visit(node, state, path, cycles, order);
                if (!cycles.isEmpty()) {
                    throw new DependencyCycleException(cycles.get(0));
                }
            }
        }
        return order;
    }

    private void visit(String node, Object2ByteMap<String> state, List<String> path,
                       List<List<String>> cycles, List<String> postOrder) {
        state.put(node, IN_PROGRESS);
        path.add(node);
        for (String target : edges.get(node)) {
            if (!edges.containsKey(target)) {
                continue;
            }
            byte targetState = state.getByte(target);
            if (targetState == IN_PROGRESS) {
                cycles.add(new ArrayList<>(path.subList(path.indexOf(target), path.size())));
            } else if (targetState == UNVISITED) {
                visit(target, state, path, cycles, postOrder);
            }
        }
        path.remove(path.size() - 1);
        state.put(node, DONE);
        if (postOrder != null) {
            postOrder.add(node);
        }
    }
}
