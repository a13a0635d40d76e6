package com.trackinglog.core.exception;

/**
 * Thrown when the caller lacks the role or ownership an operation requires.
 */
public class UnauthorizedException extends LedgerException {

    public static final String ERROR_CODE = "UNAUTHORIZED";

    public UnauthorizedException(String caller, String action) {
        super(ERROR_CODE, String.format("Caller '%s' is not authorized to %s", caller, action));
    }
}
