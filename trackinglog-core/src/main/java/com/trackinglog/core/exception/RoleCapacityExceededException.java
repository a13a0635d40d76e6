package com.trackinglog.core.exception;

/**
 * Thrown when a user's role set for a delivery is full.
 */
public class RoleCapacityExceededException extends LedgerException {

    public static final String ERROR_CODE = "ROLE_CAPACITY_EXCEEDED";

    public RoleCapacityExceededException(String user, long deliveryId, int capacity) {
        super(ERROR_CODE, String.format(
            "User '%s' already holds %d roles for delivery %d",
            user, capacity, deliveryId
        ));
    }
}
