package com.trackinglog.core.exception;

/**
 * Thrown when a status value is not a member of the delivery status set.
 */
public class InvalidStatusException extends InvalidInputException {

    public static final String ERROR_CODE = "INVALID_STATUS";

    public InvalidStatusException(String statusValue) {
        super(ERROR_CODE, "status", "unknown status value '" + statusValue + "'");
    }
}
