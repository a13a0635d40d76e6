package com.trackinglog.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Lifecycle states for a tracked delivery.
 * Non-terminal states may follow each other in any order, stages may be skipped.
 * Terminal states have no outgoing transitions.
 */
public enum DeliveryStatus {
    /**
     * Delivery registered, no operator activity yet. Initial state.
     */
    PENDING("pending"),

    /**
     * Operator acknowledged the delivery.
     */
    ASSIGNED("assigned"),

    /**
     * Payload is moving.
     */
    IN_TRANSIT("in-transit"),

    /**
     * Movement halted or running late.
     */
    DELAYED("delayed"),

    /**
     * Payload reached the destination, handover pending.
     */
    ARRIVED("arrived"),

    /**
     * Handed over to the recipient. Terminal state.
     */
    DELIVERED("delivered"),

    /**
     * Delivery could not be completed. Terminal state.
     */
    FAILED("failed"),

    /**
     * Delivery withdrawn. Terminal state.
     */
    CANCELLED("cancelled");

    private final String wireValue;

    DeliveryStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * The string form used in event logs and on the API.
     */
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     * Every non-terminal state accepts every target.
     */
    public boolean canTransitionTo(DeliveryStatus target) {
        return target != null && !isTerminal();
    }

    /**
     * Resolve a wire value. Matching is exact and case sensitive.
     */
    public static Optional<DeliveryStatus> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (DeliveryStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static DeliveryStatus fromJson(String value) {
        return fromWireValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown delivery status: " + value));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
