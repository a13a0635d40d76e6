package com.trackinglog.engine.metrics;

import com.trackinglog.core.model.DeliveryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer metrics for the delivery ledger.
 *
 * Metrics exposed:
 * - Deliveries initialized
 * - Events logged by status and oracle verification
 * - Deliveries completed by terminal status
 * - Forced failures
 * - Rejected operations by error code
 */
public class LedgerMetrics {

    // Metric names
    public static final String DELIVERIES_INITIALIZED = "trackinglog.deliveries.initialized";
    public static final String EVENTS_LOGGED = "trackinglog.events.logged";
    public static final String DELIVERIES_COMPLETED = "trackinglog.deliveries.completed";
    public static final String FAILURES_FORCED = "trackinglog.failures.forced";
    public static final String OPERATIONS_REJECTED = "trackinglog.operations.rejected";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void deliveryInitialized() {
        Counter.builder(DELIVERIES_INITIALIZED)
            .description("Total deliveries initialized")
            .register(registry)
            .increment();
    }

    public void eventLogged(DeliveryStatus status, boolean oracleVerified) {
        Counter.builder(EVENTS_LOGGED)
            .tag("status", status.wireValue())
            .tag("oracle", String.valueOf(oracleVerified))
            .description("Total event log entries appended")
            .register(registry)
            .increment();

        if (status.isTerminal()) {
            deliveryCompleted(status);
        }
    }

    public void failureForced() {
        Counter.builder(FAILURES_FORCED)
            .description("Total deliveries failed through logFailure")
            .register(registry)
            .increment();

        deliveryCompleted(DeliveryStatus.FAILED);
    }

    public void operationRejected(String operation, String errorCode) {
        Counter.builder(OPERATIONS_REJECTED)
            .tag("operation", operation)
            .tag("error", errorCode)
            .description("Total operations rejected")
            .register(registry)
            .increment();
    }

    private void deliveryCompleted(DeliveryStatus status) {
        Counter.builder(DELIVERIES_COMPLETED)
            .tag("status", status.wireValue())
            .description("Total deliveries reaching a terminal status")
            .register(registry)
            .increment();
    }
}
