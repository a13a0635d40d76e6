package com.trackinglog.core.time;

/**
 * Source of logical time for delivery records and event log entries.
 * Values are non-negative and never decrease.
 */
@FunctionalInterface
public interface LedgerClock {

    /**
     * Current logical time. Called once per mutating operation.
     */
    long now();
}
