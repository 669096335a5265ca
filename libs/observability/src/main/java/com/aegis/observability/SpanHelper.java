package com.aegis.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs governance operations inside a
 * span and tags it with the current {@link IncidentContext}.
 * <p>
 * Does not configure the SDK; the host application supplies the tracer.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "aegis.correlation.id";
    public static final String ATTR_SERVICE = "aegis.service";
    public static final String ATTR_DEPENDENCY_ID = "aegis.dependency.id";
    public static final String ATTR_FAILURE_EVENT_ID = "aegis.failure.event.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new INTERNAL span. Runtime exceptions mark the span as failed and
     * are rethrown.
     *
     * @param spanName name for the span, e.g. "governor.handleFailure"
     * @param work     the operation
     * @return the operation's result
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        Span span = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL).startSpan();

        IncidentContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.service() != null) {
                span.setAttribute(ATTR_SERVICE, ctx.service());
            }
            if (ctx.dependencyId() != null) {
                span.setAttribute(ATTR_DEPENDENCY_ID, ctx.dependencyId());
            }
            if (ctx.failureEventId() != null) {
                span.setAttribute(ATTR_FAILURE_EVENT_ID, ctx.failureEventId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Records a named event on the current span, if any. */
    public void event(String name) {
        Span.current().addEvent(name);
    }

    public Tracer tracer() {
        return tracer;
    }
}
