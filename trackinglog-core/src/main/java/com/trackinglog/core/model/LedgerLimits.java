package com.trackinglog.core.model;

/**
 * Fixed capacities and field bounds of the ledger.
 */
public final class LedgerLimits {

    public static final int MAX_LOG_ENTRIES_PER_DELIVERY = 100;
    public static final int MAX_ROLES_PER_ASSIGNMENT = 5;
    public static final int MAX_ORACLES = 10;

    public static final int FINGERPRINT_BYTES = 32;

    public static final int MAX_COORDINATE_LENGTH = 32;
    public static final int MAX_NOTE_LENGTH = 256;
    public static final int MAX_REASON_LENGTH = 256;
    public static final int MAX_IDENTITY_LENGTH = 128;

    private LedgerLimits() {
    }
}
