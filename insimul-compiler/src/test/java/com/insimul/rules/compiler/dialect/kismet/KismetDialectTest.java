package com.insimul.rules.compiler.dialect.kismet;

import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Severity;
import com.insimul.rules.api.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KismetDialectTest {

    private final KismetParser parser = new KismetParser();
    private final KismetEmitter emitter = new KismetEmitter();

    @Test
    @DisplayName("Should parse a trait with annotations and a likelihood line")
    void shouldParseTrait() {
        CompilationResult result = parser.parse("""
                % succession rules
                % @priority 9
                % @tags nobility, inheritance
                trait noble_succession:
                    inherit_title(Heir, Lord.title)
                    :- person(Heir), noble(Lord), parent_of(Lord, Heir).
                likelihood: 0.8
                """);

        assertThat(result.diagnostics()).isEmpty();
        Rule rule = result.rules().get(0);
        Variable heir = new Variable("heir");
        Variable lord = new Variable("lord");
        assertThat(rule.name()).isEqualTo("noble_succession");
        assertThat(rule.ruleType()).isEqualTo("trait");
        assertThat(rule.priority()).isEqualTo(9);
        assertThat(rule.likelihood()).isEqualTo(0.8);
        assertThat(rule.tags()).containsExactly("nobility", "inheritance");
        assertThat(rule.conditions()).isEqualTo(Condition.and(List.of(
                Predicate.of("person", heir), Predicate.of("noble", lord), Predicate.of("parent_of", lord, heir))));
        assertThat(rule.effects().get(0).args()).containsExactly(heir, new FieldAccess(lord, "title"));
    }

    @Test
    @DisplayName("Should map Prolog operators onto canonical comparisons")
    void shouldMapOperators() {
        CompilationResult result = parser.parse("""
                pattern odd_pair: :- \\+ same(X, Y), X \\= Y, Age =< 30 ; default_case.
                """);

        assertThat(result.diagnostics()).isEmpty();
        Variable x = new Variable("x");
        Variable y = new Variable("y");
        assertThat(result.rules().get(0).conditions()).isEqualTo(Condition.or(List.of(
                Condition.and(List.of(
                        Condition.not(Predicate.of("same", x, y)),
                        Predicate.comparison("!=", x, y),
                        Predicate.comparison("<=", new Variable("age"), new Constant(30L)))),
                Predicate.of("default_case"))));
    }

    @Test
    @DisplayName("A missing period should cost only the rule that lacks it")
    void shouldIsolateMissingPeriod() {
        CompilationResult result = parser.parse("""
                trait first:
                    likes(X, music)
                trait second:
                    likes(Y, dance).
                """);

        assertThat(result.rules()).extracting(Rule::name).containsExactly("second");
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.ruleName()).isEqualTo("first");
            assertThat(d.category()).isEqualTo(Diagnostic.Category.PARSE);
        });
    }

    @Test
    @DisplayName("A fractional priority annotation should be truncated with a warning")
    void shouldTruncateFractionalPriorityAnnotation() {
        CompilationResult result = parser.parse("""
                % @priority 9.5
                trait steady:
                    calm(X)
                    :- rested(X).
                """);

        assertThat(result.rules()).singleElement().extracting(Rule::priority).isEqualTo(9);
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(Diagnostic.Category.RANGE);
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.position().line()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("Should carry non-native fields as annotations")
    void shouldEmitAnnotations() {
        Rule rule = Rule.builder("Has Title")
                .ruleType("trigger")
                .conditions(Predicate.of("Noble", new Variable("who")))
                .dependency("noble_succession")
                .active(false)
                .build();

        String text = emitter.render(List.of(rule), RenderOptions.DEFAULT);

        assertThat(text).isEqualTo("""
                % @type trigger
                % @priority 5
                % @depends noble_succession
                % @active false
                trait 'Has Title':
                    :- 'Noble'(Who).
                likelihood: 1.0
                """);
        assertThat(parser.parse(text).rules()).singleElement()
                .satisfies(parsed -> assertThat(parsed.sameLogicalContent(rule)).isTrue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"heir", "Heir", "_", "_x", "__", "x1", "HEIR", "camelCase"})
    @DisplayName("Variable spelling should be invertible")
    void shouldInvertVariableSpelling(String name) {
        String token = KismetParser.variableToken(name);

        assertThat(Character.isUpperCase(token.charAt(0)) || token.charAt(0) == '_').isTrue();
        assertThat(KismetParser.variableName(token)).isEqualTo(name);
    }
}
