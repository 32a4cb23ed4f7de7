package com.tessera.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link LogContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys defined on {@link LogContext}; clearing it removes them.
 * Callers that hand work to a thread pool must transfer the context explicitly, for example with
 * {@link #runWithContext(LogContext, Runnable)}.
 */
public final class LogContextHolder {

    private static final ThreadLocal<LogContext> CONTEXT = new ThreadLocal<>();

    private LogContextHolder() {
    }

    /**
     * Sets the log context for the current thread and populates the MDC.
     *
     * @param context the log context (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(LogContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's log context, if set.
     */
    public static Optional<LogContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the log context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Restores a previously captured context, or clears the holder when {@code previous} is null.
     */
    public static void restore(LogContext previous) {
        if (previous != null) {
            set(previous);
        } else {
            clear();
        }
    }

    /**
     * Runs {@code runnable} with the given context set, then restores whatever was set before.
     *
     * @param context  the log context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(LogContext context, Runnable runnable) {
        LogContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            restore(previous);
        }
    }

    private static void populateMdc(LogContext ctx) {
        setMdc(LogContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(LogContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(LogContext.MDC_PRINCIPAL_ID, ctx.principalId());
        setMdc(LogContext.MDC_PRINCIPAL_TYPE, ctx.principalType());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(LogContext.MDC_REQUEST_ID);
        MDC.remove(LogContext.MDC_TENANT_ID);
        MDC.remove(LogContext.MDC_PRINCIPAL_ID);
        MDC.remove(LogContext.MDC_PRINCIPAL_TYPE);
    }
}
