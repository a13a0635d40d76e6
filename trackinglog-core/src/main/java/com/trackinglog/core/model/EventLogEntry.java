package com.trackinglog.core.model;

/**
 * Immutable status/location update attached to a delivery.
 *
 * Primary Key: (deliveryId, sequence)
 *
 * Invariants:
 * - sequence is contiguous from 1 within a delivery, at most 100
 * - entries are never updated or deleted
 * - oracleVerified is true iff the updater was a registered oracle when writing
 */
public record EventLogEntry(
    long deliveryId,
    long sequence,
    long logicalTime,
    String latitude,
    String longitude,
    long altitude,
    DeliveryStatus status,
    String updater,
    String note,
    boolean oracleVerified
) {
}
