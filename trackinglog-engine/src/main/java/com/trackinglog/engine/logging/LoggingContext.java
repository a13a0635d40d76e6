package com.trackinglog.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all ledger logs carry the delivery and caller they act on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forDelivery(deliveryId, caller)) {
 *     log.info("Event logged"); // Automatically includes deliveryId, caller
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.t.e.c.DeliveryLedgerCoordinator - Event logged
 *   deliveryId=42 caller=operator-7 traceId=1f2e3d4c
 */
public final class LoggingContext implements AutoCloseable {

    public static final String DELIVERY_ID = "deliveryId";
    public static final String CALLER = "caller";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for an operation on one delivery.
     */
    public static LoggingContext forDelivery(long deliveryId, String caller) {
        LoggingContext ctx = new LoggingContext();
        MDC.put(DELIVERY_ID, String.valueOf(deliveryId));
        if (caller != null) {
            MDC.put(CALLER, caller);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a global administrative operation.
     */
    public static LoggingContext forAdmin(String caller, String operation) {
        LoggingContext ctx = new LoggingContext();
        if (caller != null) {
            MDC.put(CALLER, caller);
        }
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(DELIVERY_ID);
        MDC.remove(CALLER);
        MDC.remove(OPERATION);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
