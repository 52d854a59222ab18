package com.clientspaces.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, tenantId, requestId) are
 * populated so that every log statement on this thread includes them. When cleared, the keys
 * are removed.
 * <p>
 * Work handed to a thread pool does not inherit the context. Callers transfer it explicitly with
 * {@link #runWithContext(CorrelationContext, Runnable)} or {@link #propagating(Executor)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none). A null context runs the work
     * with no context installed.
     *
     * @param context the correlation context for the duration of the runnable (nullable)
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            if (context != null) {
                set(context);
            } else {
                clear();
            }
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Wraps an executor so that every task runs with the context that was current on the
     * submitting thread at the time of this call.
     *
     * @param delegate the executor that actually runs the work
     * @return an executor that re-installs the captured context around each task
     */
    public static Executor propagating(Executor delegate) {
        CorrelationContext captured = CONTEXT.get();
        return task -> delegate.execute(() -> runWithContext(captured, task));
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }
}
