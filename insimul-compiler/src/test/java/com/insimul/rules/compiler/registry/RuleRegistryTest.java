package com.insimul.rules.compiler.registry;

import com.insimul.rules.api.exceptions.DependencyCycleException;
import com.insimul.rules.api.model.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleRegistryTest {

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry();
    }

    @Test
    @DisplayName("Should replace rules by name and keep insertion order")
    void shouldReplaceByName() {
        registry.add(Rule.builder("first").priority(1).build());
        registry.add(Rule.builder("second").build());

        List<String> replaced = registry.addAll(List.of(
                Rule.builder("first").priority(8).build(),
                Rule.builder("third").build()));

        assertThat(replaced).containsExactly("first");
        assertThat(registry.all()).extracting(Rule::name).containsExactly("first", "second", "third");
        assertThat(registry.findByName("first")).get().extracting(Rule::priority).isEqualTo(8);
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should look rules up by tag and type")
    void shouldFindByTagAndType() {
        registry.add(Rule.builder("succession").tag("nobility").build());
        registry.add(Rule.builder("rivalry").ruleType("volition").tag("nobility").build());
        registry.add(Rule.builder("market").ruleType("volition").build());

        assertThat(registry.findByTag("nobility")).extracting(Rule::name).containsExactly("succession", "rivalry");
        assertThat(registry.findByType("volition")).extracting(Rule::name).containsExactly("rivalry", "market");
        assertThat(registry.findByType("trigger")).extracting(Rule::name).containsExactly("succession");
    }

    @Test
    @DisplayName("Should return rules in dependency order")
    void shouldOrderByDependencies() {
        registry.add(Rule.builder("wedding").dependency("courtship").build());
        registry.add(Rule.builder("courtship").build());

        assertThat(registry.inDependencyOrder()).extracting(Rule::name).containsExactly("courtship", "wedding");
    }

    @Test
    @DisplayName("Should store cyclic rules but refuse to order them")
    void shouldStoreCyclicRules() {
        registry.add(Rule.builder("a").dependency("b").build());
        registry.add(Rule.builder("b").dependency("a").build());

        assertThat(registry.contains("a")).isTrue();
        assertThatThrownBy(registry::inDependencyOrder).isInstanceOf(DependencyCycleException.class);

        registry.remove("b");
        assertThat(registry.inDependencyOrder()).extracting(Rule::name).containsExactly("a");
        registry.clear();
        assertThat(registry.isEmpty()).isTrue();
    }
}
