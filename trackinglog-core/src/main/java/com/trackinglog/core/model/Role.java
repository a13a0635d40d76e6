package com.trackinglog.core.model;

/**
 * Capabilities grantable per (user, delivery).
 * Numeric codes are stable and used on the API.
 */
public enum Role {
    OPERATOR(1),
    ORACLE(2),
    ADMIN(3),
    SUPPLIER(4),
    RECIPIENT(5);

    private final int code;

    Role(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolve a role from its numeric code.
     *
     * @throws IllegalArgumentException if no role has this code
     */
    public static Role fromCode(int code) {
        for (Role role : values()) {
            if (role.code == code) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role code: " + code);
    }
}
