package com.trackinglog.core.exception;

/**
 * Base exception for all ledger errors.
 * Every rejected operation surfaces as a subclass, thrown before any state is written.
 */
public class LedgerException extends RuntimeException {

    private final String errorCode;

    public LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
