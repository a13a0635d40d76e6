package com.trackinglog.engine.service;

import com.trackinglog.core.model.PayloadFingerprint;

/**
 * Mutating operations of the delivery ledger.
 * Every operation validates completely before writing; a rejected call leaves no trace.
 */
public interface DeliveryLedgerService {

    /**
     * Create a delivery record in PENDING state together with its initial roles.
     *
     * @param request The initialization request
     * @throws com.trackinglog.core.exception.AlreadyInitializedException if the id is taken
     * @throws com.trackinglog.core.exception.PausedException if the ledger is paused
     * @throws com.trackinglog.core.exception.InvalidInputException if a field is out of bounds
     */
    void initializeDelivery(InitializeDeliveryRequest request);

    /**
     * Append a status/location update and move the delivery to its status.
     *
     * @param request The event request
     * @return The sequence number of the new entry
     * @throws com.trackinglog.core.exception.NotFoundException if the delivery does not exist
     * @throws com.trackinglog.core.exception.PausedException if the ledger is paused
     * @throws com.trackinglog.core.exception.AlreadyCompletedException if the delivery is terminal
     * @throws com.trackinglog.core.exception.UnauthorizedException if the caller is neither operator nor oracle
     * @throws com.trackinglog.core.exception.InvalidStatusException if the status is unknown
     * @throws com.trackinglog.core.exception.InvalidLocationException if a coordinate is empty
     * @throws com.trackinglog.core.exception.LogLimitExceededException if 100 entries exist
     */
    long logEvent(LogEventRequest request);

    /**
     * Force a delivery into FAILED state without appending a log entry.
     *
     * @param request The failure request; the caller must hold the operator role
     * @throws com.trackinglog.core.exception.NotFoundException if the delivery does not exist
     * @throws com.trackinglog.core.exception.PausedException if the ledger is paused
     * @throws com.trackinglog.core.exception.AlreadyCompletedException if the delivery is terminal
     * @throws com.trackinglog.core.exception.UnauthorizedException if the caller is not an operator
     */
    void logFailure(LogFailureRequest request);

    /**
     * Request to initialize a delivery.
     */
    record InitializeDeliveryRequest(
        String caller,
        long deliveryId,
        String operator,
        String supplier,
        String recipient,
        long expectedArrival,
        PayloadFingerprint payloadFingerprint
    ) {}

    /**
     * Request to append an event log entry. The status is the raw wire value.
     */
    record LogEventRequest(
        String caller,
        long deliveryId,
        String latitude,
        String longitude,
        long altitude,
        String status,
        String note
    ) {}

    /**
     * Request to force a delivery into FAILED state.
     */
    record LogFailureRequest(
        String caller,
        long deliveryId,
        String reason
    ) {}
}
