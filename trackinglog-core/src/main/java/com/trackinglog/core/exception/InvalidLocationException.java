package com.trackinglog.core.exception;

/**
 * Thrown when a latitude or longitude is missing or empty.
 */
public class InvalidLocationException extends InvalidInputException {

    public static final String ERROR_CODE = "INVALID_LOCATION";

    public InvalidLocationException(String field) {
        super(ERROR_CODE, field, "cannot be empty");
    }
}
