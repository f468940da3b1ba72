/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.config;

import com.insimul.rules.api.IRuleCompiler;
import com.insimul.rules.compiler.UnifiedRuleCompiler;
import com.insimul.rules.compiler.cache.CompiledOutputCache;
import com.insimul.rules.compiler.catalog.PredicateCatalog;
import com.insimul.rules.compiler.dialect.DialectRegistry;
import com.insimul.rules.service.telemetry.TracingService;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CDI producers for the compiler and its collaborators.
 */
@ApplicationScoped
public class RuleCompilerProducers {

    private static final Logger logger = LoggerFactory.getLogger(RuleCompilerProducers.class);

    @ConfigProperty(name = "insimul.predicates.catalog", defaultValue = PredicateCatalog.DEFAULT_RESOURCE)
    String catalogLocation;

    @ConfigProperty(name = "insimul.render-cache.max-size", defaultValue = "10000")
    long renderCacheMaxSize;

    @Produces
    @Singleton
    public TracingService tracingService() {
        return TracingService.getInstance();
    }

    @Produces
    @ApplicationScoped
    public Tracer tracer(TracingService tracingService) {
        return tracingService.getTracer();
    }

    /**
     * Loads the predicate catalog from a file when the configured location is
     * an existing path, otherwise from the classpath.
     */
    @Produces
    @Singleton
    public PredicateCatalog predicateCatalog() {
        Path path = Paths.get(catalogLocation);
        if (Files.isRegularFile(path)) {
            try {
                return PredicateCatalog.load(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load predicate catalog from " + path, e);
            }
        }
        logger.debug("Predicate catalog {} is not a file, reading it from the classpath", catalogLocation);
        return PredicateCatalog.loadResource(catalogLocation);
    }

    @Produces
    @Singleton
    public DialectRegistry dialectRegistry() {
        return DialectRegistry.defaults();
    }

    @Produces
    @Singleton
    public CompiledOutputCache compiledOutputCache() {
        return new CompiledOutputCache.Builder()
                .maxSize(renderCacheMaxSize)
                .build();
    }

    @Produces
    @ApplicationScoped
    public IRuleCompiler ruleCompiler(Tracer tracer, DialectRegistry dialects, PredicateCatalog catalog,
                                      CompiledOutputCache cache) {
        logger.info("Creating rule compiler: dialects={}, predicates={}, actions={}, renderCacheMaxSize={}",
                dialects.supportedDialects(), catalog.predicateCount(), catalog.actionCount(), renderCacheMaxSize);
        return new UnifiedRuleCompiler(tracer, dialects, catalog, cache);
    }
}
