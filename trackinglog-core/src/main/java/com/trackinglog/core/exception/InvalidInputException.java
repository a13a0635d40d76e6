package com.trackinglog.core.exception;

/**
 * Thrown when an operation argument is outside its accepted domain.
 */
public class InvalidInputException extends LedgerException {

    public static final String ERROR_CODE = "INVALID_INPUT";

    private final String field;

    public InvalidInputException(String field, String reason) {
        this(ERROR_CODE, field, reason);
    }

    protected InvalidInputException(String errorCode, String field, String reason) {
        super(errorCode, String.format("Invalid %s: %s", field, reason));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
