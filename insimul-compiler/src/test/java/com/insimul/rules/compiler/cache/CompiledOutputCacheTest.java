package com.insimul.rules.compiler.cache;

import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;
import com.insimul.rules.compiler.SampleRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CompiledOutputCacheTest {

    private CompiledOutputCache cache;
    private AtomicInteger renders;

    @BeforeEach
    void setUp() {
        cache = new CompiledOutputCache.Builder()
                .maxSize(100)
                .expireAfterAccess(Duration.ofMinutes(5))
                .recordStats(true)
                .build();
        renders = new AtomicInteger();
    }

    private String render(String text) {
        renders.incrementAndGet();
        return text;
    }

    @Test
    @DisplayName("Should render once per rule list, dialect and options")
    void shouldRenderOnce() {
        List<Rule> rules = List.of(SampleRules.nobleSuccession());

        cache.get(rules, Dialect.KISMET, RenderOptions.DEFAULT, () -> render("kismet"));
        cache.get(rules, Dialect.KISMET, RenderOptions.DEFAULT, () -> render("kismet"));
        cache.get(rules, Dialect.KISMET, RenderOptions.compact(), () -> render("compact"));
        cache.get(rules, Dialect.TOTT, RenderOptions.DEFAULT, () -> render("tott"));

        assertThat(renders).hasValue(3);
        assertThat(cache.stats().hitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore where a rule was parsed from")
    void shouldIgnoreSourceDialect() {
        Rule rule = SampleRules.courtRivalry();

        cache.get(List.of(rule.withSourceDialect(Dialect.ENSEMBLE)), Dialect.INSIMUL, RenderOptions.DEFAULT,
                () -> render("insimul"));
        String cached = cache.get(List.of(rule.withSourceDialect(Dialect.TOTT)), Dialect.INSIMUL,
                RenderOptions.DEFAULT, () -> render("other"));

        assertThat(cached).isEqualTo("insimul");
        assertThat(renders).hasValue(1);
    }

    @Test
    @DisplayName("An edited rule should miss the cache")
    void shouldMissForEditedRule() {
        Rule rule = SampleRules.welcomeVisitor();
        cache.get(List.of(rule), Dialect.INSIMUL, RenderOptions.DEFAULT, () -> render("v1"));

        Rule edited = rule.toBuilder().priority(7).build();
        String text = cache.get(List.of(edited), Dialect.INSIMUL, RenderOptions.DEFAULT, () -> render("v2"));

        assertThat(text).isEqualTo("v2");
        assertThat(cache.compiledOutput(rule)).containsEntry(Dialect.INSIMUL, "v1");
        assertThat(cache.compiledOutput(edited)).containsEntry(Dialect.INSIMUL, "v2");
    }

    @Test
    @DisplayName("Should drop everything on invalidation")
    void shouldInvalidateAll() {
        cache.get(List.of(SampleRules.welcomeVisitor()), Dialect.TOTT, RenderOptions.DEFAULT, () -> render("x"));

        cache.invalidateAll();
        cache.get(List.of(SampleRules.welcomeVisitor()), Dialect.TOTT, RenderOptions.DEFAULT, () -> render("x"));

        assertThat(renders).hasValue(2);
    }
}
