package com.insimul.rules.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insimul.rules.api.exceptions.UnknownDialectException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTest {

    private static final Variable HEIR = new Variable("heir");
    private static final Variable LORD = new Variable("lord");

    @Test
    @DisplayName("Should clamp priority and likelihood into range")
    void shouldClampNumericFields() {
        Rule rule = Rule.builder("loud").priority(15).likelihood(-0.5).build();

        assertThat(rule.priority()).isEqualTo(Rule.MAX_PRIORITY);
        assertThat(rule.likelihood()).isEqualTo(0.0);
        assertThat(Rule.builder("quiet").priority(-3).build().priority()).isEqualTo(Rule.MIN_PRIORITY);
        assertThat(Rule.builder("odd").likelihood(Double.NaN).build().likelihood())
                .isEqualTo(Rule.DEFAULT_LIKELIHOOD);
    }

    @Test
    @DisplayName("The rule keyword and a missing type should both mean trigger")
    void shouldNormalizeRuleType() {
        assertThat(Rule.builder("a").ruleType("rule").build().ruleType()).isEqualTo("trigger");
        assertThat(Rule.builder("b").ruleType(null).build().ruleType()).isEqualTo("trigger");
        assertThat(Rule.builder("c").ruleType("volition").build().ruleType()).isEqualTo("volition");
    }

    @Test
    @DisplayName("A rule without conditions should hold unconditionally")
    void shouldDefaultToAlways() {
        Rule rule = Rule.builder("always").build();

        assertThat(rule.conditions().isAlways()).isTrue();
        assertThat(rule.effects()).isEmpty();
        assertThat(rule.active()).isTrue();
    }

    @Test
    @DisplayName("Single-child connectives should collapse to the child")
    void shouldCollapseSingleChild() {
        Predicate person = Predicate.of("Person", HEIR);

        assertThat(Condition.and(List.of(person))).isSameAs(person);
        assertThat(Condition.or(List.of(person))).isSameAs(person);
        assertThat(Condition.and(List.of())).isEqualTo(Condition.always());
    }

    @Test
    @DisplayName("Comparisons should only accept the six infix operators")
    void shouldRejectUnknownComparison() {
        assertThat(Predicate.comparison(">=", HEIR, new Constant(16)).isComparison()).isTrue();
        assertThatThrownBy(() -> Predicate.comparison("=~", HEIR, LORD))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("=~");
    }

    @Test
    @DisplayName("Constants should widen small numeric types")
    void shouldWidenConstants() {
        assertThat(new Constant(16)).isEqualTo(new Constant(16L));
        assertThat(new Constant(2.5f)).isEqualTo(new Constant(2.5));
        assertThatThrownBy(() -> new Constant(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Effect kinds should follow the action-name convention unless overridden")
    void shouldInferEffectKind() {
        assertThat(Effect.of("create_child", HEIR).kind()).isEqualTo(EffectKind.CREATE_ENTITY);
        assertThat(Effect.of("tracery_generate", HEIR).kind()).isEqualTo(EffectKind.TEXT_GENERATION);
        assertThat(Effect.of("inherit_title", HEIR).hasExplicitKind()).isFalse();
        assertThat(new Effect("announce_heir", List.of(HEIR), EffectKind.EVENT).hasExplicitKind()).isTrue();
    }

    @Test
    @DisplayName("Logical comparison should ignore the source dialect")
    void shouldIgnoreSourceDialect() {
        Rule rule = Rule.builder("x").tag("a").build();

        assertThat(rule.withSourceDialect(Dialect.KISMET).sameLogicalContent(rule)).isTrue();
        assertThat(rule.withSourceDialect(Dialect.KISMET)).isNotEqualTo(rule);
        assertThat(rule.toBuilder().priority(2).build().sameLogicalContent(rule)).isFalse();
    }

    @Test
    @DisplayName("Dialect tags should resolve case-insensitively")
    void shouldResolveDialectTags() {
        assertThat(Dialect.fromTag(" TotT ")).isEqualTo(Dialect.TOTT);
        assertThatThrownBy(() -> Dialect.fromTag("prolog"))
                .isInstanceOf(UnknownDialectException.class)
                .hasMessageContaining("prolog");
    }

    @Test
    @DisplayName("A rule should survive the JSON form used by the HTTP surface")
    void shouldReadBackFromJson() throws Exception {
        Rule rule = Rule.builder("noble_succession")
                .priority(9)
                .likelihood(0.8)
                .conditions(Condition.and(List.of(
                        Predicate.of("Noble", LORD),
                        Condition.not(Condition.or(List.of(
                                Predicate.of("dead", HEIR),
                                Predicate.comparison("<", new FieldAccess(HEIR, "age"), new Constant(16L))))))))
                .effect(Effect.of("inherit_title", HEIR, new FieldAccess(LORD, "title")))
                .effect(new Effect("announce_heir", List.of(HEIR), EffectKind.EVENT))
                .tag("nobility")
                .dependency("succession_base")
                .active(false)
                .sourceDialect(Dialect.INSIMUL)
                .build();
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(rule);
        Rule back = mapper.readValue(json, Rule.class);

        assertThat(json).contains("\"isActive\":false").contains("\"sourceDialect\":\"insimul\"")
                .contains("\"kind\":\"emit\"");
        assertThat(back).isEqualTo(rule);
    }
}
