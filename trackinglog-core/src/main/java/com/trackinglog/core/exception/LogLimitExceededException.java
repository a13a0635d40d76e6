package com.trackinglog.core.exception;

/**
 * Thrown when a delivery already holds the maximum number of event log entries.
 */
public class LogLimitExceededException extends LedgerException {

    public static final String ERROR_CODE = "LOG_LIMIT_EXCEEDED";

    public LogLimitExceededException(long deliveryId, int limit) {
        super(ERROR_CODE, String.format(
            "Delivery %d reached the event log limit of %d entries",
            deliveryId, limit
        ));
    }
}
