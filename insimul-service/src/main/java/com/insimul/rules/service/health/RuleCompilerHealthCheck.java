/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.health;

import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.compiler.catalog.PredicateCatalog;
import com.insimul.rules.compiler.dialect.DialectRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once every dialect has a parser and emitter and the predicate catalog is loaded.
 */
@Readiness
@ApplicationScoped
public class RuleCompilerHealthCheck implements HealthCheck {

    @Inject
    DialectRegistry dialects;

    @Inject
    PredicateCatalog catalog;

    @Override
    public HealthCheckResponse call() {
        int supported = dialects.supportedDialects().size();
        if (supported == Dialect.values().length) {
            return HealthCheckResponse.builder()
                    .name("rule-compiler")
                    .up()
                    .withData("dialects", supported)
                    .withData("predicates", catalog.predicateCount())
                    .withData("actions", catalog.actionCount())
                    .build();
        }
        return HealthCheckResponse.builder()
                .name("rule-compiler")
                .down()
                .withData("reason", "Only " + supported + " of " + Dialect.values().length + " dialects registered")
                .build();
    }
}
