package com.trackinglog.core.exception;

/**
 * Thrown when a referenced delivery has no record.
 */
public class NotFoundException extends LedgerException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }

    public static NotFoundException delivery(long deliveryId) {
        return new NotFoundException("Delivery", String.valueOf(deliveryId));
    }
}
