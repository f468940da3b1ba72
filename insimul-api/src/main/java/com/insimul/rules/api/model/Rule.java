/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named behavioral unit in its canonical, dialect-agnostic form.
 *
 * <p>Rules are immutable. The surrounding application edits a rule by replacing
 * its source text and parsing again, so there are no setters; {@link #toBuilder()}
 * exists for tools that assemble rules programmatically.
 *
 * <p>{@code priority} and {@code likelihood} are stored clamped into
 * [{@value #MIN_PRIORITY}, {@value #MAX_PRIORITY}] and [0.0, 1.0]. Parsers report
 * an out-of-range source value as a warning before it reaches this constructor.
 *
 * <h2>Usage</h2>
 * <pre>
 * Rule rule = Rule.builder("noble_succession")
 *     .ruleType("trigger")
 *     .priority(9)
 *     .conditions(Condition.and(List.of(
 *         Predicate.of("Noble", Term.variable("lord")),
 *         Predicate.of("dies", Term.variable("lord")))))
 *     .effect(Effect.of("inherit_title", Term.variable("heir"),
 *         Term.field(Term.variable("lord"), "title")))
 *     .build();
 * </pre>
 */
public record Rule(
        @JsonProperty("name") String name,
        @JsonProperty("ruleType") String ruleType,
        @JsonProperty("priority") int priority,
        @JsonProperty("likelihood") double likelihood,
        @JsonProperty("conditions") Condition conditions,
        @JsonProperty("effects") List<Effect> effects,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("isActive") boolean active,
        @JsonProperty("sourceDialect") Dialect sourceDialect
) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;
    public static final double DEFAULT_LIKELIHOOD = 1.0;
    public static final String DEFAULT_RULE_TYPE = "trigger";

    public Rule {
        Objects.requireNonNull(name, "Rule name cannot be null");
        ruleType = normalizeRuleType(ruleType);
        priority = clampPriority(priority);
        likelihood = clampLikelihood(likelihood);
        if (conditions == null) conditions = Condition.always();
        effects = effects == null ? List.of() : List.copyOf(effects);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static int clampPriority(int priority) {
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }

    public static double clampLikelihood(double likelihood) {
        if (Double.isNaN(likelihood)) {
            return DEFAULT_LIKELIHOOD;
        }
        return Math.max(0.0, Math.min(1.0, likelihood));
    }

    /**
     * The unified syntax spells trigger rules with the {@code rule} keyword; every
     * other rule type is an open value kept verbatim.
     */
    public static String normalizeRuleType(String ruleType) {
        if (ruleType == null || ruleType.isBlank() || ruleType.equals("rule")) {
            return DEFAULT_RULE_TYPE;
        }
        return ruleType;
    }

    /**
     * Compares everything except {@link #sourceDialect()}, which records where
     * the rule was last parsed from rather than what it says.
     */
    public boolean sameLogicalContent(Rule other) {
        return other != null
                && name.equals(other.name)
                && ruleType.equals(other.ruleType)
                && priority == other.priority
                && Double.compare(likelihood, other.likelihood) == 0
                && conditions.equals(other.conditions)
                && effects.equals(other.effects)
                && tags.equals(other.tags)
                && dependencies.equals(other.dependencies)
                && active == other.active;
    }

    public Rule withSourceDialect(Dialect dialect) {
        return new Rule(name, ruleType, priority, likelihood, conditions, effects,
                tags, dependencies, active, dialect);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name)
                .ruleType(ruleType)
                .priority(priority)
                .likelihood(likelihood)
                .conditions(conditions)
                .active(active)
                .sourceDialect(sourceDialect);
        effects.forEach(builder::effect);
        tags.forEach(builder::tag);
        dependencies.forEach(builder::dependency);
        return builder;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private String name;
        private String ruleType = DEFAULT_RULE_TYPE;
        private int priority = DEFAULT_PRIORITY;
        private double likelihood = DEFAULT_LIKELIHOOD;
        private Condition conditions = Condition.always();
        private final List<Effect> effects = new ArrayList<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<String> dependencies = new ArrayList<>();
        private boolean active = true;
        private Dialect sourceDialect;

        private Builder(String name) {
            this.name = name;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder ruleType(String ruleType) {
            this.ruleType = ruleType;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder likelihood(double likelihood) {
            this.likelihood = likelihood;
            return this;
        }

        public Builder conditions(Condition conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder effect(Effect effect) {
            this.effects.add(effect);
            return this;
        }

        public Builder effects(List<Effect> effects) {
            this.effects.clear();
            this.effects.addAll(effects);
            return this;
        }

        public Builder tag(String tag) {
            tags.add(tag);
            return this;
        }

        public boolean hasTag(String tag) {
            return tags.contains(tag);
        }

        public Builder tags(Set<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder dependency(String dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies.clear();
            this.dependencies.addAll(dependencies);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder sourceDialect(Dialect sourceDialect) {
            this.sourceDialect = sourceDialect;
            return this;
        }

        public String name() {
            return name;
        }

        public Rule build() {
            return new Rule(name, ruleType, priority, likelihood, conditions, effects,
                    tags, dependencies, active, sourceDialect);
        }
    }
}
