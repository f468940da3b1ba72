/*
 * Copyright (c) 2025 Insimul Rule Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.insimul.rules.service.rest;

import com.insimul.rules.api.IRuleCompiler;
import com.insimul.rules.api.exceptions.UnknownDialectException;
import com.insimul.rules.api.model.CompilationResult;
import com.insimul.rules.api.model.Dialect;
import com.insimul.rules.api.model.DialectSwitchResult;
import com.insimul.rules.api.model.RenderOptions;
import com.insimul.rules.api.model.ValidationReport;
import com.insimul.rules.service.model.CompileRequest;
import com.insimul.rules.service.model.DialectInfo;
import com.insimul.rules.service.model.ExportRequest;
import com.insimul.rules.service.model.ExportResponse;
import com.insimul.rules.service.model.PrologExportResponse;
import com.insimul.rules.service.model.SwitchRequest;
import com.insimul.rules.service.model.ValidateRequest;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * JAX-RS resource exposing compile, export, validate and dialect switch, plus a
 * one-way SWI-Prolog export.
 *
 * <p>Rule-level problems come back in the response body as diagnostics with a
 * 200 status. A 400 means the request itself was unusable: a missing body, an
 * unknown dialect tag or missing content.
 */
@Path("/dialects")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DialectResource {

    private static final Logger logger = LoggerFactory.getLogger(DialectResource.class);

    @Inject
    IRuleCompiler compiler;

    @Inject
    Tracer tracer;

    @ConfigProperty(name = "insimul.export.pretty-print", defaultValue = "true")
    boolean defaultPrettyPrint;

    @GET
    public Response listDialects() {
        List<DialectInfo> dialects = Arrays.stream(Dialect.values()).map(DialectInfo::of).toList();
        return Response.ok(dialects).build();
    }

    @POST
    @Path("/compile")
    public Response compile(CompileRequest request) {
        Span span = tracer.spanBuilder("http-compile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            requireBody(request);
            Dialect dialect = Dialect.fromTag(request.dialect());
            span.setAttribute("dialect", dialect.tag());

            CompilationResult result = compiler.compile(request.content(), dialect);

            span.setAttribute("ruleCount", result.rules().size());
            span.setAttribute("diagnosticCount", result.diagnostics().size());
            return Response.ok(result).build();

        } catch (UnknownDialectException | IllegalArgumentException | NullPointerException e) {
            span.recordException(e);
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError("compile", e);
        } finally {
            span.end();
        }
    }

    /**
     * Renders canonical rules into the requested dialect.
     */
    @POST
    @Path("/export")
    public Response export(ExportRequest request) {
        Span span = tracer.spanBuilder("http-export").startSpan();
        try (Scope scope = span.makeCurrent()) {
            requireBody(request);
            Dialect dialect = Dialect.fromTag(request.dialect());
            if (request.rules() == null) {
                throw new IllegalArgumentException("rules is required");
            }
            span.setAttribute("dialect", dialect.tag());
            span.setAttribute("ruleCount", request.rules().size());

            String content = compiler.export(request.rules(), dialect, renderOptions(request));

            return Response.ok(new ExportResponse(dialect, request.rules().size(), content)).build();

        } catch (UnknownDialectException | IllegalArgumentException | NullPointerException e) {
            span.recordException(e);
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError("export", e);
        } finally {
            span.end();
        }
    }

    /**
     * Renders canonical rules as an SWI-Prolog program. The {@code dialect}
     * field of the request is ignored.
     */
    @POST
    @Path("/export/prolog")
    public Response exportProlog(ExportRequest request) {
        Span span = tracer.spanBuilder("http-export-prolog").startSpan();
        try (Scope scope = span.makeCurrent()) {
            requireBody(request);
            if (request.rules() == null) {
                throw new IllegalArgumentException("rules is required");
            }
            span.setAttribute("ruleCount", request.rules().size());

            String content = compiler.exportProlog(request.rules(), renderOptions(request));

            return Response.ok(PrologExportResponse.of(request.rules().size(), content)).build();

        } catch (IllegalArgumentException | NullPointerException e) {
            span.recordException(e);
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError("export-prolog", e);
        } finally {
            span.end();
        }
    }

    @POST
    @Path("/validate")
    public Response validate(ValidateRequest request) {
        Span span = tracer.spanBuilder("http-validate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            requireBody(request);
            ValidationReport report;
            if (request.content() != null) {
                Dialect dialect = Dialect.fromTag(request.dialect());
                span.setAttribute("dialect", dialect.tag());
                report = compiler.validate(request.content(), dialect);
            } else if (request.rules() != null) {
                span.setAttribute("ruleCount", request.rules().size());
                report = compiler.validate(request.rules());
            } else {
                throw new IllegalArgumentException("Either content or rules is required");
            }

            span.setAttribute("isValid", report.isValid());
            span.setAttribute("errors", report.errors().size());
            return Response.ok(report).build();

        } catch (UnknownDialectException | IllegalArgumentException | NullPointerException e) {
            span.recordException(e);
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError("validate", e);
        } finally {
            span.end();
        }
    }

    /**
     * Converts a document between dialects. Content that does not parse in the
     * source dialect comes back unchanged with {@code converted=false}.
     */
    @POST
    @Path("/switch")
    public Response switchDialect(SwitchRequest request) {
        Span span = tracer.spanBuilder("http-switch-dialect").startSpan();
        try (Scope scope = span.makeCurrent()) {
            requireBody(request);
            Dialect from = Dialect.fromTag(request.from());
            Dialect to = Dialect.fromTag(request.to());
            if (request.content() == null) {
                throw new IllegalArgumentException("content is required");
            }
            span.setAttribute("from", from.tag());
            span.setAttribute("to", to.tag());

            DialectSwitchResult result = compiler.switchDialect(request.content(), from, to);

            span.setAttribute("converted", result.converted());
            return Response.ok(result).build();

        } catch (UnknownDialectException | IllegalArgumentException | NullPointerException e) {
            span.recordException(e);
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError("switch", e);
        } finally {
            span.end();
        }
    }

    private RenderOptions renderOptions(ExportRequest request) {
        return new RenderOptions(
                request.prettyPrint() == null ? defaultPrettyPrint : request.prettyPrint(),
                Boolean.TRUE.equals(request.includeComments()),
                request.bindings());
    }

    private static void requireBody(Object request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
    }

    private static Response badRequest(Exception e) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", "Bad Request", "message", String.valueOf(e.getMessage())))
                .build();
    }

    private static Response serverError(String operation, Exception e) {
        logger.error("Unexpected failure in {}", operation, e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(Map.of("error", "Internal Server Error", "message", String.valueOf(e.getMessage())))
                .build();
    }
}
