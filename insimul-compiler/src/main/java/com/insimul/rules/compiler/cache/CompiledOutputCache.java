/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.compiler.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.Rule;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Rendered text per rule list, dialect and options.
 *
 * <p>Keys hold the immutable rule values themselves, so editing a rule produces
 * a new key and stale renderings simply age out. The source dialect is not part
 * of a rule's logical content and is stripped from keys.
 *
 * <pre>{@code
 * CompiledOutputCache cache = new CompiledOutputCache.Builder()
 *     .maxSize(5_000)
 *     .expireAfterAccess(Duration.ofMinutes(30))
 *     .build();
 * }</pre>
 */
public class CompiledOutputCache {

    private static final long DEFAULT_MAX_SIZE = 10_000L;
    private static final Duration DEFAULT_EXPIRY = Duration.ofHours(1);

    record Key(List<Rule> rules, Dialect dialect, RenderOptions options) {
    }

    private final Cache<Key, String> cache;

    private CompiledOutputCache(Builder builder) {
        Caffeine<Object, Object> caffeine = Caffeine.newBuilder()
                .maximumSize(builder.maxSize)
                .expireAfterAccess(builder.expireAfterAccess);
        if (builder.recordStats) {
            caffeine.recordStats();
        }
        this.cache = caffeine.build();
    }

    public static CompiledOutputCache withDefaults() {
        return new Builder().build();
    }

    /**
     * Returns the cached rendering, computing and storing it on a miss.
     */
    public String get(List<Rule> rules, Dialect dialect, RenderOptions options, Supplier<String> render) {
        return cache.get(key(rules, dialect, options), k -> render.get());
    }

    /**
     * Renderings of a rule exported on its own with default options that are
     * currently cached, by dialect. Documents the rule was rendered into along
     * with other rules, or with other options, are not looked up.
     */
    public Map<Dialect, String> compiledOutput(Rule rule) {
        Map<Dialect, String> output = new EnumMap<>(Dialect.class);
        for (Dialect dialect : Dialect.values()) {
            String text = cache.getIfPresent(key(List.of(rule), dialect, RenderOptions.DEFAULT));
            if (text != null) {
                output.put(dialect, text);
            }
        }
        return output;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private static Key key(List<Rule> rules, Dialect dialect, RenderOptions options) {
        return new Key(rules.stream().map(rule -> rule.withSourceDialect(null)).toList(), dialect, options);
    }

    public static class Builder {
        private long maxSize = DEFAULT_MAX_SIZE;
        private Duration expireAfterAccess = DEFAULT_EXPIRY;
        private boolean recordStats = true;

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder expireAfterAccess(Duration expireAfterAccess) {
            this.expireAfterAccess = expireAfterAccess;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CompiledOutputCache build() {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("maxSize must be positive");
            }
            return new CompiledOutputCache(this);
        }
    }
}
