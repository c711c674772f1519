package com.kotsin.structure.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * TraceContext - Thread-local context for end-to-end run tracing.
 *
 * Carries the trace id of the execution context through the worker threads
 * that process individual symbols. Values are mirrored into the SLF4J MDC
 * ({@code traceId}, {@code mode}, {@code symbol}) for the log pattern.
 *
 * Usage:
 *   TraceContext.start(ctx.getTraceId(), "batch", "AAPL");
 *   try {
 *       log.info("{} Processing started", TraceContext.getPrefix());
 *   } finally {
 *       TraceContext.clear();
 *   }
 */
public final class TraceContext {

    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_MODE = "mode";
    public static final String MDC_SYMBOL = "symbol";

    private static final ThreadLocal<Context> CONTEXT = new ThreadLocal<>();

    private TraceContext() {
        // Utility class
    }

    /**
     * Start a trace for one symbol within a run.
     *
     * @param traceId Trace id of the execution context
     * @param mode    event or batch
     * @param symbol  Symbol being processed, null for run-level logging
     */
    public static void start(String traceId, String mode, String symbol) {
        CONTEXT.set(new Context(traceId, mode, symbol));
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_MODE, mode);
        if (symbol != null) {
            MDC.put(MDC_SYMBOL, symbol);
        } else {
            MDC.remove(MDC_SYMBOL);
        }
    }

    /**
     * Clear the current trace context.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_MODE);
        MDC.remove(MDC_SYMBOL);
    }

    /**
     * Get a formatted log prefix containing trace context.
     *
     * @return Formatted prefix like "[traceId=ab12cd34|mode=batch|symbol=AAPL]"
     */
    public static String getPrefix() {
        Context ctx = CONTEXT.get();
        if (ctx == null) {
            return "";
        }
        if (ctx.symbol == null) {
            return String.format("[traceId=%s|mode=%s]", ctx.traceId, ctx.mode);
        }
        return String.format("[traceId=%s|mode=%s|symbol=%s]", ctx.traceId, ctx.mode, ctx.symbol);
    }

    /**
     * Generate a trace id for contexts that arrive without one.
     * Format: 8 character hex string for readability.
     */
    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Internal context holder.
     */
    private static class Context {
        final String traceId;
        final String mode;
        final String symbol;

        Context(String traceId, String mode, String symbol) {
            this.traceId = traceId;
            this.mode = mode;
            this.symbol = symbol;
        }
    }
}
