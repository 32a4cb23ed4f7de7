package com.tessera.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the identifiers
 * of the current {@link LogContext}.
 * <p>
 * Only the OTel API is used here; the SDK (exporter, sampler) is configured by the hosting
 * service. With no SDK installed the tracer is a no-op.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span. Runtime exceptions are recorded on the span
     * and rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the result of {@code work}
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();
        LogContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("request.id", ctx.requestId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.principalId() != null) {
                span.setAttribute("principal.id", ctx.principalId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
