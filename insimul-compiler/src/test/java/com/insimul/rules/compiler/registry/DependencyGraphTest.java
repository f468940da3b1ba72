package com.insimul.rules.compiler.registry;

import com.insimul.rules.api.exceptions.DependencyCycleException;
import com.insimul.rules.api.model.Rule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    private static Rule rule(String name, String... dependencies) {
        return Rule.builder(name).dependencies(List.of(dependencies)).build();
    }

    @Test
    @DisplayName("Should order rules after their dependencies")
    void shouldOrderTopologically() {
        DependencyGraph graph = DependencyGraph.of(List.of(
                rule("wedding", "courtship", "dowry"),
                rule("courtship", "meeting"),
                rule("dowry"),
                rule("meeting")));

        List<String> order = graph.topologicalOrder();

        assertThat(order).containsExactly("meeting", "courtship", "dowry", "wedding");
        assertThat(graph.findCycles()).isEmpty();
    }

    @Test
    @DisplayName("Should report each back edge's cycle once without repeating its first node")
    void shouldFindEachCycleOnce() {
        DependencyGraph graph = DependencyGraph.of(List.of(
                rule("a", "b"),
                rule("b", "a"),
                rule("c", "c"),
                rule("d", "a")));

        assertThat(graph.findCycles()).containsExactly(List.of("a", "b"), List.of("c"));
    }

    @Test
    @DisplayName("Overlapping cycles reached through a finished node should share one report")
    void shouldReportOverlappingCyclesThroughFirstBackEdge() {
        DependencyGraph graph = DependencyGraph.of(List.of(
                rule("a", "b", "c"),
                rule("b", "c"),
                rule("c", "a")));

        assertThat(graph.findCycles()).containsExactly(List.of("a", "b", "c"));
    }

    @Test
    @DisplayName("Should refuse to order a cyclic graph")
    void shouldThrowOnCycle() {
        DependencyGraph graph = DependencyGraph.of(List.of(rule("a", "b"), rule("b", "c"), rule("c", "a")));

        assertThatThrownBy(graph::topologicalOrder)
                .isInstanceOf(DependencyCycleException.class)
                .hasMessage("Dependency cycle: a -> b -> c -> a")
                .satisfies(e -> assertThat(((DependencyCycleException) e).getCycle()).containsExactly("a", "b", "c"));
    }

    @Test
    @DisplayName("Should skip and report dependencies on unknown rules")
    void shouldHandleMissingDependencies() {
        DependencyGraph graph = DependencyGraph.of(List.of(rule("a", "ghost", "b"), rule("b")));

        assertThat(graph.topologicalOrder()).containsExactly("b", "a");
        assertThat(graph.missingDependencies()).isEqualTo(Map.of("a", List.of("ghost")));
        assertThat(graph.dependentsOf("b")).containsExactly("a");
        assertThat(graph.dependenciesOf("a")).containsExactly("ghost", "b");
    }
}
