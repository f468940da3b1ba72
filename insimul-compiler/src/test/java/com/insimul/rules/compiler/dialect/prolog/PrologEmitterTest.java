package com.insimul.rules.compiler.dialect.prolog;

import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Effect;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.SampleRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrologEmitterTest {

    private final PrologEmitter emitter = new PrologEmitter();

    @Test
    @DisplayName("Should declare every predicate dynamic and write one clause per effect")
    void shouldRenderProgram() {
        Variable x = new Variable("x");
        Rule rule = Rule.builder("greet")
                .conditions(Condition.and(List.of(
                        Predicate.of("Person", x),
                        Predicate.comparison("<=", new Variable("age"), new Constant(30L)))))
                .effect(Effect.of("add_thought", x, new Constant("hello")))
                .effect(Effect.of("wave"))
                .tag("social")
                .build();

        assertThat(emitter.render(List.of(rule), RenderOptions.DEFAULT)).isEqualTo("""
                :- dynamic 'Person'/1.
                :- dynamic add_thought/2.
                :- dynamic wave/0.

                % greet (trigger, priority 5, likelihood 1.0)
                % tags: social
                add_thought(X, hello) :-
                    'Person'(X), Age =< 30.
                wave :-
                    'Person'(X), Age =< 30.
                """);
    }

    @Test
    @DisplayName("A rule without conditions becomes facts and one without effects is headed by its name")
    void shouldRenderFactsAndNamedClauses() {
        Rule fact = Rule.builder("dawn").effect(Effect.of("light", new Constant("sun"))).build();
        Rule check = Rule.builder("is_noble").conditions(Predicate.of("noble", new Variable("who"))).build();

        String text = emitter.render(List.of(fact, check), RenderOptions.compact());

        assertThat(text)
                .contains("light(sun).\n")
                .contains("is_noble :- noble(Who).\n")
                .doesNotContain("dynamic is_noble");
    }

    @Test
    @DisplayName("Clauses of an inactive rule should be commented out")
    void shouldCommentOutInactiveRule() {
        String text = emitter.render(List.of(SampleRules.courtRivalry()), RenderOptions.DEFAULT);

        assertThat(text).contains("% inactive\n% reduce_reputation(B, true) :-\n%     ");
        assertThat(text.lines().filter(line -> !line.isEmpty() && !line.startsWith("%") && !line.startsWith(":-")))
                .isEmpty();
    }

    @Test
    @DisplayName("Negation and disjunction should use Prolog operators")
    void shouldRenderConnectives() {
        String text = emitter.render(List.of(SampleRules.nobleSuccession()), RenderOptions.compact());

        assertThat(text).contains(
                "inherit_title(Heir, Lord.title) :- 'Person'(Heir), 'Noble'(Lord), parent_of(Lord, Heir), "
                        + "\\+ (dead(Heir); Heir.age < 16).");
        assertThat(text).contains("announce_heir(Heir) :- ");
        assertThat(text).contains(":- dynamic dead/1.\n");
    }

    @Test
    @DisplayName("Rule names with line breaks should stay inside their comment")
    void shouldFlattenNamesInComments() {
        Rule rule = Rule.builder("evil\nhalt.").effect(Effect.of("noop")).build();

        String text = emitter.render(List.of(rule), RenderOptions.compact());

        assertThat(text).contains("% evil halt. (trigger").contains("\nnoop.\n").doesNotContain("\nhalt.");
    }
}
