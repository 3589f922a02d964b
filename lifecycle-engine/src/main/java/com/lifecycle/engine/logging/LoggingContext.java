package com.lifecycle.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the stream, projector or rebuild being worked on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forProjector(projectorName)) {
 *     log.info("Dispatching"); // Automatically includes projector
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2026-01-07 10:30:45.123 [projector-2] INFO  c.l.e.p.ProjectorDispatcher - Dispatched 12 events
 *   projector=open_case_counts traceId=3f2a9c1d
 */
public final class LoggingContext implements AutoCloseable {

    public static final String AGGREGATE_TYPE = "aggregateType";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String PROJECTOR = "projector";
    public static final String EVENT_ID = "eventId";
    public static final String GLOBAL_SEQUENCE = "globalSequence";
    public static final String REBUILD_ID = "rebuildId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for operations on one aggregate stream.
     */
    public static LoggingContext forAggregate(String aggregateType, UUID aggregateId) {
        LoggingContext ctx = new LoggingContext();
        if (aggregateType != null) {
            MDC.put(AGGREGATE_TYPE, aggregateType);
        }
        if (aggregateId != null) {
            MDC.put(AGGREGATE_ID, aggregateId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for projector dispatch.
     */
    public static LoggingContext forProjector(String projectorName) {
        LoggingContext ctx = new LoggingContext();
        if (projectorName != null) {
            MDC.put(PROJECTOR, projectorName);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a rebuild run.
     */
    public static LoggingContext forRebuild(UUID rebuildId, String projectorName) {
        LoggingContext ctx = forProjector(projectorName);
        if (rebuildId != null) {
            MDC.put(REBUILD_ID, rebuildId.toString());
        }
        return ctx;
    }

    /**
     * Add the event being applied to the current context.
     */
    public static void setEvent(UUID eventId, long globalSequence) {
        if (eventId != null) {
            MDC.put(EVENT_ID, eventId.toString());
            MDC.put(GLOBAL_SEQUENCE, String.valueOf(globalSequence));
        }
    }

    /**
     * Adopt a caller-supplied trace ID, or start a new one when none is given.
     */
    public static void startTrace(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            MDC.put(TRACE_ID, traceId.trim());
        } else {
            ensureTraceId();
        }
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(AGGREGATE_TYPE);
        MDC.remove(AGGREGATE_ID);
        MDC.remove(PROJECTOR);
        MDC.remove(EVENT_ID);
        MDC.remove(GLOBAL_SEQUENCE);
        MDC.remove(REBUILD_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or scheduler tick.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
