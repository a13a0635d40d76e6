package com.trackinglog.core.exception;

/**
 * Thrown when the oracle registry is full.
 */
public class OracleCapacityExceededException extends LedgerException {

    public static final String ERROR_CODE = "ORACLE_CAPACITY_EXCEEDED";

    public OracleCapacityExceededException(int capacity) {
        super(ERROR_CODE, "Oracle registry is full (capacity " + capacity + ")");
    }
}
