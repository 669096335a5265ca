package com.aegis.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link IncidentContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys; clearing removes them. Nested scopes restore the
 * outer context when they finish.
 */
public final class IncidentContextHolder {

    private static final ThreadLocal<IncidentContext> CONTEXT = new ThreadLocal<>();

    private IncidentContextHolder() {
        // Utility class
    }

    /**
     * Sets the incident context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(IncidentContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<IncidentContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(IncidentContext.MDC_CORRELATION_ID);
        MDC.remove(IncidentContext.MDC_SERVICE);
        MDC.remove(IncidentContext.MDC_DEPENDENCY_ID);
        MDC.remove(IncidentContext.MDC_FAILURE_EVENT_ID);
    }

    /**
     * Runs {@code work} with {@code context} set, then restores the previous context (or clears
     * if there was none).
     *
     * @return the value produced by {@code work}
     */
    public static <T> T callWithContext(IncidentContext context, Supplier<T> work) {
        IncidentContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(IncidentContext ctx) {
        setMdc(IncidentContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(IncidentContext.MDC_SERVICE, ctx.service());
        setMdc(IncidentContext.MDC_DEPENDENCY_ID, ctx.dependencyId());
        setMdc(IncidentContext.MDC_FAILURE_EVENT_ID, ctx.failureEventId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
