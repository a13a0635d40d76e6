package com.trackinglog.core.exception;

/**
 * Thrown when a gated operation is attempted while the ledger is paused.
 */
public class PausedException extends LedgerException {

    public static final String ERROR_CODE = "PAUSED";

    public PausedException() {
        super(ERROR_CODE, "Ledger is paused");
    }
}
