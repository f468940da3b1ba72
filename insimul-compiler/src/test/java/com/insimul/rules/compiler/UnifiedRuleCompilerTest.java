package com.insimul.rules.compiler;

import com.insimul.rules.api.IRuleCompiler;
import com.insimul.rules.api.exceptions.UnknownDialectException;
import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Condition;
import com.insimul.rules.api.model.Diagnostic;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.DialectSwitchResult;
import com.insimul.rules.api.model.FieldAccess;
import com.insimul.rules.api.model.Predicate;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.api.model.Severity;
import com.insimul.rules.api.model.ValidationReport;
import com.insimul.rules.compiler.catalog.PredicateCatalog;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UnifiedRuleCompilerTest {

    private static final String NOBLE_SUCCESSION = """
            rule noble_succession {
              when (Person(?heir) and Noble(?lord) and parent_of(?lord, ?heir))
              then {
                inherit_title(?heir, ?lord.title)
              }
              priority: 9
              tags: [nobility, inheritance]
            }
            """;

    private UnifiedRuleCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new UnifiedRuleCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Should compile the noble succession rule into the canonical model")
    void shouldCompileNobleSuccession() {
        CompilationResult result = compiler.compile(NOBLE_SUCCESSION, Dialect.INSIMUL);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.rules()).hasSize(1);
        Rule rule = result.rules().get(0);
        assertThat(rule.name()).isEqualTo("noble_succession");
        assertThat(rule.ruleType()).isEqualTo("trigger");
        assertThat(rule.priority()).isEqualTo(9);
        assertThat(rule.likelihood()).isEqualTo(1.0);
        assertThat(rule.tags()).containsExactly("nobility", "inheritance");
        assertThat(rule.sourceDialect()).isEqualTo(Dialect.INSIMUL);
        assertThat(rule.effects()).hasSize(1);
        assertThat(rule.effects().get(0).action()).isEqualTo("inherit_title");
        assertThat(rule.effects().get(0).args().get(1))
                .isEqualTo(new FieldAccess(SampleRules.LORD, "title"));
        assertThat(rule.conditions()).isEqualTo(Condition.and(List.of(
                Predicate.of("Person", SampleRules.HEIR),
                Predicate.of("Noble", SampleRules.LORD),
                Predicate.of("parent_of", SampleRules.LORD, SampleRules.HEIR))));
    }

    @Test
    @DisplayName("Should return an empty result for blank content")
    void shouldReturnEmptyResultForBlankContent() {
        CompilationResult result = compiler.compile("   \n", Dialect.KISMET);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("Should clamp an out-of-range priority and warn exactly once")
    void shouldClampPriorityWithOneWarning() {
        String content = """
                rule loud {
                  then { add_thought(?x, "hello") }
                  priority: 15
                }
                """;

        CompilationResult result = compiler.compile(content, Dialect.INSIMUL);

        assertThat(result.rules()).singleElement().extracting(Rule::priority).isEqualTo(10);
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.category()).isEqualTo(Diagnostic.Category.RANGE);
            assertThat(d.ruleName()).isEqualTo("loud");
        });
    }

    @Test
    @DisplayName("A malformed block should cost only that rule")
    void shouldIsolateMalformedBlock() {
        String content = """
                rule first {
                  then { add_thought(?x, "one") }
                }
                rule bad {
                  when Person(?x and
                }
                rule third {
                  then { add_thought(?x, "three") }
                }
                """;

        CompilationResult result = compiler.compile(content, Dialect.INSIMUL);

        assertThat(result.rules()).extracting(Rule::name).containsExactly("first", "third");
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.ERROR);
            assertThat(d.category()).isEqualTo(Diagnostic.Category.PARSE);
            assertThat(d.ruleName()).isEqualTo("bad");
            assertThat(d.position()).isNotNull();
            assertThat(d.position().line()).isEqualTo(5);
        });
    }

    @Test
    @DisplayName("Should throw for an unregistered dialect")
    void shouldRejectUnknownDialectTag() {
        assertThatThrownBy(() -> compiler.compile("rule a {}", Dialect.fromTag("prolog")))
                .isInstanceOf(UnknownDialectException.class)
                .hasMessageContaining("prolog");
    }

    @Nested
    class Validation {

        @Test
        @DisplayName("Should report a two-rule dependency cycle exactly once")
        void shouldReportCycleOnce() {
            String content = """
                    rule a {
                      then { add_thought(?x, "a") }
                      dependencies: [b]
                    }
                    rule b {
                      then { add_thought(?x, "b") }
                      dependencies: [a]
                    }
                    """;

            ValidationReport report = compiler.validate(content, Dialect.INSIMUL);

            assertThat(report.isValid()).isFalse();
            assertThat(report.errors()).singleElement().satisfies(d -> {
                assertThat(d.category()).isEqualTo(Diagnostic.Category.CYCLE);
                assertThat(d.message()).isEqualTo("Dependency cycle: a -> b -> a");
            });
        }

        @Test
        @DisplayName("Should reject empty content")
        void shouldRejectEmptyContent() {
            ValidationReport report = compiler.validate("", Dialect.TOTT);

            assertThat(report.isValid()).isFalse();
            assertThat(report.errors()).extracting(Diagnostic::message)
                    .containsExactly("Rule content cannot be empty");
        }

        @Test
        @DisplayName("Validating the same content twice should give the same report")
        void shouldBeIdempotent() {
            String content = compiler.export(SampleRules.all(), Dialect.KISMET, RenderOptions.DEFAULT);

            ValidationReport first = compiler.validate(content, Dialect.KISMET);
            ValidationReport second = compiler.validate(content, Dialect.KISMET);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Should combine parse diagnostics with semantic findings")
        void shouldCombineParseAndSemanticDiagnostics() {
            String content = """
                    rule first {
                      then { add_thought(?x, "one") }
                      dependencies: [missing_rule]
                    }
                    rule broken {
                      priority: high
                    }
                    """;

            ValidationReport report = compiler.validate(content, Dialect.INSIMUL);

            assertThat(report.errors()).singleElement()
                    .extracting(Diagnostic::category).isEqualTo(Diagnostic.Category.PARSE);
            assertThat(report.warnings()).extracting(Diagnostic::category)
                    .contains(Diagnostic.Category.REFERENCE);
        }

        @Test
        @DisplayName("Should suggest known predicates when a registry is set")
        void shouldSuggestPredicatesFromRegistry() {
            compiler.setPredicateRegistry(PredicateCatalog.loadDefault());
            String content = """
                    rule typo {
                      when (Persn(?x))
                      then { add_thought(?x, "hi") }
                    }
                    """;

            ValidationReport report = compiler.validate(content, Dialect.INSIMUL);

            assertThat(report.isValid()).isTrue();
            assertThat(report.suggestions()).extracting(Diagnostic::message)
                    .anySatisfy(m -> assertThat(m).contains("Persn").contains("did you mean Person"));
        }
    }

    @Nested
    class DialectSwitch {

        @Test
        @DisplayName("Should convert parseable content to the target dialect")
        void shouldConvertContent() {
            DialectSwitchResult result = compiler.switchDialect(NOBLE_SUCCESSION, Dialect.INSIMUL, Dialect.TOTT);

            assertThat(result.converted()).isTrue();
            assertThat(result.dialect()).isEqualTo(Dialect.TOTT);
            assertThat(result.warning()).isNull();
            assertThat(result.content()).contains("def noble_succession(heir, lord):");

            CompilationResult back = compiler.compile(result.content(), Dialect.TOTT);
            assertThat(back.rules()).singleElement().satisfies(rule ->
                    assertThat(rule.sameLogicalContent(compiler.compile(NOBLE_SUCCESSION, Dialect.INSIMUL)
                            .rules().get(0))).isTrue());
        }

        @Test
        @DisplayName("Should keep content unchanged when nothing parses")
        void shouldFailClosed() {
            String content = "this is not kismet at all";

            DialectSwitchResult result = compiler.switchDialect(content, Dialect.KISMET, Dialect.INSIMUL);

            assertThat(result.converted()).isFalse();
            assertThat(result.content()).isEqualTo(content);
            assertThat(result.dialect()).isEqualTo(Dialect.KISMET);
            assertThat(result.warning()).isNotNull();
            assertThat(result.warning().category()).isEqualTo(Diagnostic.Category.CONVERSION);
        }

        @Test
        @DisplayName("Should warn when malformed blocks were left out of the conversion")
        void shouldWarnAboutDroppedBlocks() {
            String content = NOBLE_SUCCESSION + """
                    rule broken {
                      when (
                    }
                    """;

            DialectSwitchResult result = compiler.switchDialect(content, Dialect.INSIMUL, Dialect.ENSEMBLE);

            assertThat(result.converted()).isTrue();
            assertThat(result.content()).contains("\"noble_succession\"").doesNotContain("broken");
            assertThat(result.warning()).isNotNull();
            assertThat(result.warning().message()).startsWith("1 malformed block");
        }

        @Test
        @DisplayName("Switching to the same dialect should leave content untouched")
        void shouldNotTouchSameDialect() {
            DialectSwitchResult result = compiler.switchDialect("anything", Dialect.TOTT, Dialect.TOTT);

            assertThat(result.content()).isEqualTo("anything");
            assertThat(result.dialect()).isEqualTo(Dialect.TOTT);
            assertThat(result.warning()).isNull();
        }
    }

    @Test
    @DisplayName("Export should reuse cached renderings")
    void shouldCacheExports() {
        List<Rule> rules = List.of(SampleRules.nobleSuccession());

        String first = compiler.export(rules, Dialect.INSIMUL, RenderOptions.DEFAULT);
        String second = compiler.export(List.of(SampleRules.nobleSuccession().withSourceDialect(Dialect.KISMET)),
                Dialect.INSIMUL, RenderOptions.DEFAULT);

        assertThat(second).isSameAs(first);
        assertThat(compiler.compiledOutput(SampleRules.nobleSuccession())).containsOnlyKeys(Dialect.INSIMUL);
    }

    @Test
    @DisplayName("Compiled output should only list renderings of the rule exported on its own")
    void shouldNotListMultiRuleRenderingsAsCompiledOutput() {
        compiler.export(SampleRules.all(), Dialect.KISMET, RenderOptions.DEFAULT);
        compiler.export(List.of(SampleRules.nobleSuccession()), Dialect.TOTT, RenderOptions.compact());

        assertThat(compiler.compiledOutput(SampleRules.nobleSuccession())).isEmpty();

        compiler.export(List.of(SampleRules.nobleSuccession()), Dialect.KISMET, RenderOptions.DEFAULT);

        assertThat(compiler.compiledOutput(SampleRules.nobleSuccession())).containsOnlyKeys(Dialect.KISMET);
    }

    @Test
    @DisplayName("Should export compiled rules as an SWI-Prolog program")
    void shouldExportProlog() {
        List<Rule> rules = compiler.compile(NOBLE_SUCCESSION, Dialect.INSIMUL).rules();

        String program = compiler.exportProlog(rules, null);

        assertThat(program).startsWith(":- dynamic 'Noble'/1.\n:- dynamic 'Person'/1.\n")
                .contains(":- dynamic inherit_title/2.\n")
                .contains("% noble_succession (trigger, priority 9, likelihood 1.0)\n% tags: nobility, inheritance\n")
                .contains("inherit_title(Heir, Lord.title) :-\n    'Person'(Heir), 'Noble'(Lord), parent_of(Lord, Heir).\n");
        assertThat(compiler.compiledOutput(rules.get(0))).isEmpty();
    }

    @Test
    @DisplayName("Should open a span per operation")
    void shouldTraceOperations() {
        Tracer tracer = mock(Tracer.class);
        SpanBuilder spanBuilder = mock(SpanBuilder.class);
        Span span = mock(Span.class);
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        compiler.setTracer(tracer);

        compiler.compile(NOBLE_SUCCESSION, Dialect.INSIMUL);
        compiler.export(SampleRules.all(), Dialect.ENSEMBLE, RenderOptions.compact());
        compiler.exportProlog(SampleRules.all(), RenderOptions.compact());

        verify(tracer).spanBuilder("compile-rules");
        verify(tracer).spanBuilder("export-rules");
        verify(tracer).spanBuilder("export-prolog");
        verify(span, atLeastOnce()).end();
    }

    @Test
    @DisplayName("Should be discoverable through ServiceLoader")
    void shouldLoadThroughServiceLoader() {
        assertThat(ServiceLoader.load(IRuleCompiler.class))
                .anySatisfy(c -> assertThat(c).isInstanceOf(UnifiedRuleCompiler.class));
    }
}
