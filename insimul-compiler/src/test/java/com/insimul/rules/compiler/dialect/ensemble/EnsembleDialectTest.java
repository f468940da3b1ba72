package com.insimul.rules.compiler.dialect.ensemble;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Constant;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.NameBinding;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Severity;
import com.insimul.rules.api.model.Variable;
import com.insimul.rules.compiler.SampleRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class EnsembleDialectTest {

    private final EnsembleParser parser = new EnsembleParser();
    private final EnsembleEmitter emitter = new EnsembleEmitter();

    @Test
    @DisplayName("Should read trigger and volition sections with their rule types")
    void shouldReadSections() {
        CompilationResult result = parser.parse("""
                {
                  "fileName": "court.json",
                  "triggerRules": {"rules": [
                    {"name": "befriend", "conditions": [{"predicate": "is_coworker", "first": "x", "second": "y"}],
                     "effects": [{"action": "add_thought", "first": "x", "second": {"value": "a new friend"}}]}
                  ]},
                  "volitionRules": {"rules": [
                    {"name": "court", "weight": 4, "likelihood": 0.3,
                     "conditions": {"operator": ">=", "first": "x.charm", "second": 7}}
                  ]}
                }
                """);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.rules()).extracting(Rule::name, Rule::ruleType)
                .containsExactly(tuple("befriend", "trigger"),
                        tuple("court", "volition"));
        Rule court = result.rules().get(1);
        assertThat(court.priority()).isEqualTo(4);
        assertThat(court.conditions()).isEqualTo(Predicate.comparison(">=",
                new FieldAccess(new Variable("x"), "charm"), new Constant(7L)));
        assertThat(result.rules().get(0).effects().get(0).args())
                .containsExactly(new Variable("x"), new Constant("a new friend"));
        assertThat(result.rules()).allMatch(rule -> rule.sourceDialect() == Dialect.ENSEMBLE);
    }

    @Test
    @DisplayName("Should convert legacy category conditions and flag dropped operators")
    void shouldConvertLegacyConditions() {
        CompilationResult result = parser.parse("""
                [{"name": "old_friends",
                  "conditions": [{"category": "relationship", "type": "friends", "first": "x", "second": "y",
                                  "value": true, "operator": ">"}],
                  "effects": [{"category": "network", "type": "affinity", "first": "x", "second": "y", "value": 5}]}]
                """);

        Rule rule = result.rules().get(0);
        assertThat(rule.conditions()).isEqualTo(Predicate.of("relationship_friends",
                new Variable("x"), new Variable("y"), new Constant(true)));
        assertThat(rule.effects().get(0).action()).isEqualTo("network_affinity");
        assertThat(rule.effects().get(0).args()).endsWith(new Constant(5L));
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.category()).isEqualTo(Diagnostic.Category.CONVERSION);
        });
    }

    @Test
    @DisplayName("A malformed entry should cost only that rule")
    void shouldIsolateMalformedEntry() {
        CompilationResult result = parser.parse("""
                {"rules": [
                  {"name": "good", "effects": []},
                  {"name": "bad", "weight": "high"},
                  {"effects": []}
                ],
                 "cast": ["alice"]}
                """);

        assertThat(result.rules()).extracting(Rule::name).containsExactly("good");
        assertThat(result.diagnostics()).filteredOn(d -> d.severity() == Severity.ERROR)
                .extracting(Diagnostic::ruleName).containsExactly("bad", null);
        assertThat(result.diagnostics()).filteredOn(d -> d.category() == Diagnostic.Category.STRUCTURE)
                .singleElement().extracting(Diagnostic::message).asString().contains("'cast'");
        assertThat(result.diagnostics()).filteredOn(d -> "bad".equals(d.ruleName()))
                .singleElement().satisfies(d -> assertThat(d.position().line()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should keep rules read before a JSON syntax error")
    void shouldKeepRulesBeforeSyntaxError() {
        CompilationResult result = parser.parse("""
                [{"name": "kept", "effects": []},
                 {"name": "cut" "effects": []}]
                """);

        assertThat(result.rules()).extracting(Rule::name).containsExactly("kept");
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.message()).startsWith("Invalid JSON");
            assertThat(d.position()).isNotNull();
        });
    }

    @Test
    @DisplayName("Content after the top-level JSON value should be a parse error")
    void shouldRejectTrailingContent() {
        CompilationResult result = parser.parse("""
                [{"name": "kept", "effects": []}]
                {"name": "stray"}
                """);

        assertThat(result.rules()).extracting(Rule::name).containsExactly("kept");
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.ERROR);
            assertThat(d.category()).isEqualTo(Diagnostic.Category.PARSE);
            assertThat(d.message()).isEqualTo("Unexpected content after the top-level JSON value");
            assertThat(d.position().line()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Whole-number and oversized weights should be read as priorities")
    void shouldReadNumericWeights() {
        CompilationResult result = parser.parse("""
                [{"name": "steady", "weight": 9.0},
                 {"name": "huge", "weight": 1e30}]
                """);

        assertThat(result.rules()).extracting(Rule::name, Rule::priority)
                .containsExactly(tuple("steady", 9), tuple("huge", 10));
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.category()).isEqualTo(Diagnostic.Category.RANGE);
            assertThat(d.ruleName()).isEqualTo("huge");
        });
    }

    @Test
    @DisplayName("Should read legacy text rules when the content is not JSON")
    void shouldReadLegacyTextRules() {
        CompilationResult result = parser.parse("""
                rule noble_succession {
                  when (Person(?heir) and Noble(?lord) and parent_of(?lord, ?heir))
                  then {
                    inherit_title(?heir, ?lord.title)
                  }
                }
                """);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.rules()).singleElement().satisfies(rule -> {
            assertThat(rule.name()).isEqualTo("noble_succession");
            assertThat(rule.sourceDialect()).isEqualTo(Dialect.ENSEMBLE);
            assertThat(rule.effects()).extracting(effect -> effect.action()).containsExactly("inherit_title");
        });
    }

    @Test
    @DisplayName("Text without any rule block should still be reported as invalid JSON")
    void shouldReportPlainTextAsInvalidJson() {
        CompilationResult result = parser.parse("not a rule file");

        assertThat(result.rules()).isEmpty();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(Diagnostic.Category.PARSE);
            assertThat(d.message()).startsWith("Invalid JSON");
        });
    }

    @Test
    @DisplayName("Should write metadata, comments and example bindings")
    void shouldEmitDocument() throws Exception {
        RenderOptions options = new RenderOptions(true, true, List.of(new NameBinding("1", "Aldric")));

        String text = emitter.render(List.of(SampleRules.nobleSuccession()), options);

        JsonNode document = new ObjectMapper().readTree(text);
        assertThat(document.path("_comment").asText()).isEqualTo("ensemble rules (1)");
        JsonNode rule = document.path("rules").get(0);
        assertThat(rule.path("weight").asInt()).isEqualTo(9);
        assertThat(rule.path("conditions").size()).isEqualTo(4);
        assertThat(rule.path("conditions").get(0).path("predicate").asText()).isEqualTo("Person");
        assertThat(rule.path("effects").get(2).path("kind").asText()).isEqualTo("emit");
        assertThat(rule.path("_meta").path("tags")).hasSize(2);
        assertThat(rule.path("_meta").has("active")).isFalse();
        assertThat(rule.path("_example").path("heir").asText()).isEqualTo("Aldric");
        assertThat(parser.parse(text).rules()).singleElement()
                .satisfies(parsed -> assertThat(parsed.sameLogicalContent(SampleRules.nobleSuccession())).isTrue());
    }
}
