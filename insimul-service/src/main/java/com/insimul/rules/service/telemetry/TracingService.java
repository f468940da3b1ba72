/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * OpenTelemetry setup for the rule compiler service.
 *
 * <p>Spans are batched and written through the logging exporter. Configuration
 * is read from environment variables, falling back to system properties:
 * <ul>
 *   <li>{@code OTEL_DISABLED}: use a noop tracer (default false)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0 to 1.0 (default 1.0)</li>
 *   <li>{@code SERVICE_NAME}, {@code SERVICE_VERSION}, {@code DEPLOYMENT_ENVIRONMENT}</li>
 * </ul>
 */
public class TracingService {
    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    private static final String INSTRUMENTATION_NAME = "com.insimul.rule-compiler";
    private static final String DEFAULT_SERVICE_NAME = "insimul-rule-compiler";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is disabled (OTEL_DISABLED=true)");
            return noop();
        }

        try {
            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(SERVICE_VERSION, getEnvOrProperty("SERVICE_VERSION", "unknown"))
                    .put(DEPLOYMENT_ENVIRONMENT, getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev"))
                    .build()));

            Sampler sampler = Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio())).build();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(LoggingSpanExporter.create())
                            .setMaxQueueSize(2048)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .buildAndRegisterGlobal();

            logger.info("OpenTelemetry initialized with logging exporter, sampler={}", sampler.getDescription());
            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize OpenTelemetry, falling back to noop", e);
            return noop();
        }
    }

    private static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    private static double samplingRatio() {
        String raw = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warn("Invalid OTEL_TRACE_SAMPLING_RATIO '{}', sampling everything", raw);
            return 1.0;
        }
    }

    /**
     * Drains buffered spans. Safe to call more than once.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (RuntimeException e) {
            logger.warn("Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
