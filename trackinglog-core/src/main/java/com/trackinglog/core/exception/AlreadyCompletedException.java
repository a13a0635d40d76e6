package com.trackinglog.core.exception;

import com.trackinglog.core.model.DeliveryStatus;

/**
 * Thrown when a mutating operation targets a delivery in a terminal state.
 */
public class AlreadyCompletedException extends LedgerException {

    public static final String ERROR_CODE = "ALREADY_COMPLETED";

    public AlreadyCompletedException(long deliveryId, DeliveryStatus status) {
        super(ERROR_CODE, String.format(
            "Delivery %d is already completed with status %s",
            deliveryId, status
        ));
    }
}
