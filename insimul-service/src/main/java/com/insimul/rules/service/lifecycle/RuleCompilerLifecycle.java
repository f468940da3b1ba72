/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.lifecycle;

import com.insimul.rules.compiler.cache.CompiledOutputCache;
import com.insimul.rules.service.telemetry.TracingService;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class RuleCompilerLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(RuleCompilerLifecycle.class);

    @Inject
    TracingService tracingService;

    @Inject
    CompiledOutputCache outputCache;

    void onStart(@Observes StartupEvent event) {
        logger.info("Insimul rule compiler started (tracing {})",
                tracingService.isEnabled() ? "enabled" : "disabled");
    }

    void onStop(@Observes ShutdownEvent event) {
        logger.info("Shutting down rule compiler, {} cached renderings dropped", outputCache.estimatedSize());
        outputCache.invalidateAll();
        tracingService.shutdown();
    }
}
