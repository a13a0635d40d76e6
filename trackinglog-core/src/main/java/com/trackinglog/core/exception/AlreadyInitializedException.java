package com.trackinglog.core.exception;

/**
 * Thrown when a delivery id is initialized a second time.
 */
public class AlreadyInitializedException extends LedgerException {

    public static final String ERROR_CODE = "ALREADY_INITIALIZED";

    private final long deliveryId;

    public AlreadyInitializedException(long deliveryId) {
        super(ERROR_CODE, "Delivery already initialized: " + deliveryId);
        this.deliveryId = deliveryId;
    }

    public long getDeliveryId() {
        return deliveryId;
    }
}
