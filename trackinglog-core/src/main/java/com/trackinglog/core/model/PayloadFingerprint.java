package com.trackinglog.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.trackinglog.core.exception.InvalidInputException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed-size content hash of a delivery payload.
 * The ledger never interprets the bytes; it only enforces the length.
 */
public final class PayloadFingerprint {

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private PayloadFingerprint(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wrap a copy of the given bytes.
     *
     * @throws InvalidInputException if the array is not exactly 32 bytes long
     */
    public static PayloadFingerprint of(byte[] bytes) {
        if (bytes == null || bytes.length != LedgerLimits.FINGERPRINT_BYTES) {
            throw new InvalidInputException("payloadFingerprint",
                "expected " + LedgerLimits.FINGERPRINT_BYTES + " bytes, got "
                    + (bytes == null ? "none" : bytes.length));
        }
        return new PayloadFingerprint(bytes.clone());
    }

    /**
     * Parse a 64-character hex string.
     *
     * @throws InvalidInputException if the string is not valid hex of the right length
     */
    @JsonCreator
    public static PayloadFingerprint fromHex(String hex) {
        if (hex == null || hex.length() != LedgerLimits.FINGERPRINT_BYTES * 2) {
            throw new InvalidInputException("payloadFingerprint",
                "expected " + (LedgerLimits.FINGERPRINT_BYTES * 2) + " hex characters");
        }
        try {
            return new PayloadFingerprint(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("payloadFingerprint", "not a hex string");
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PayloadFingerprint other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
