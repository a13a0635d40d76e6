package com.trackinglog.core.model;

/**
 * The tracked state of one delivery.
 * Primary source of truth for delivery status.
 *
 * Primary Key: deliveryId (caller supplied)
 *
 * Invariants:
 * - completed is true iff status is terminal
 * - sequence equals the number of event log entries ever written and never decreases
 * - once completed, status, sequence and completed never change
 * - actualArrival is set only when an event log entry completes the delivery
 */
public record DeliveryRecord(
    // Primary key
    long deliveryId,

    // State
    DeliveryStatus status,

    // Parties
    String operator,
    String supplier,
    String recipient,

    // Timing (logical clock values)
    long startTime,
    long expectedArrival,
    Long actualArrival,

    // Payload
    PayloadFingerprint payloadFingerprint,

    // Event log position
    long sequence,

    boolean completed,
    String failureReason
) {
    /**
     * Create a new delivery record in PENDING state.
     */
    public static DeliveryRecord create(
            long deliveryId,
            String operator,
            String supplier,
            String recipient,
            long startTime,
            long expectedArrival,
            PayloadFingerprint payloadFingerprint) {
        return new DeliveryRecord(
            deliveryId,
            DeliveryStatus.PENDING,
            operator,
            supplier,
            recipient,
            startTime,
            expectedArrival,
            null,
            payloadFingerprint,
            0L,
            false,
            null
        );
    }

    /**
     * Create a copy reflecting a newly appended event log entry.
     * A terminal status completes the delivery and stamps the arrival time.
     */
    public DeliveryRecord withEvent(DeliveryStatus newStatus, long newSequence, long logicalTime) {
        requireOpen(newStatus);
        if (newSequence != sequence + 1) {
            throw new IllegalStateException(String.format(
                "Delivery %d expected sequence %d, got %d", deliveryId, sequence + 1, newSequence));
        }
        boolean terminal = newStatus.isTerminal();
        return new DeliveryRecord(
            deliveryId, newStatus, operator, supplier, recipient,
            startTime, expectedArrival,
            terminal ? Long.valueOf(logicalTime) : actualArrival,
            payloadFingerprint, newSequence, terminal, failureReason
        );
    }

    /**
     * Create a copy forced into FAILED state. Sequence is left untouched.
     */
    public DeliveryRecord withFailure(String reason) {
        requireOpen(DeliveryStatus.FAILED);
        return new DeliveryRecord(
            deliveryId, DeliveryStatus.FAILED, operator, supplier, recipient,
            startTime, expectedArrival, actualArrival,
            payloadFingerprint, sequence, true, reason
        );
    }

    private void requireOpen(DeliveryStatus target) {
        if (completed || !status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Delivery %d cannot move from %s to %s", deliveryId, status, target));
        }
    }
}
