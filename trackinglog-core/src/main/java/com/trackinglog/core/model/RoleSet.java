package com.trackinglog.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded list of roles held by one user for one delivery.
 *
 * Invariants:
 * - at most {@link LedgerLimits#MAX_ROLES_PER_ASSIGNMENT} entries
 * - duplicates are allowed and counted against capacity
 * - immutable; mutators return a new set
 */
public record RoleSet(List<Role> roles) {

    private static final RoleSet EMPTY = new RoleSet(List.of());

    public RoleSet {
        if (roles == null) {
            throw new IllegalArgumentException("roles cannot be null");
        }
        if (roles.size() > LedgerLimits.MAX_ROLES_PER_ASSIGNMENT) {
            throw new IllegalArgumentException(
                "Role set exceeds capacity of " + LedgerLimits.MAX_ROLES_PER_ASSIGNMENT + ": " + roles);
        }
        roles = List.copyOf(roles);
    }

    public static RoleSet empty() {
        return EMPTY;
    }

    public static RoleSet of(Role... roles) {
        return new RoleSet(List.of(roles));
    }

    public boolean contains(Role role) {
        return roles.contains(role);
    }

    public int size() {
        return roles.size();
    }

    public boolean isFull() {
        return roles.size() >= LedgerLimits.MAX_ROLES_PER_ASSIGNMENT;
    }

    /**
     * Create a copy with the role appended.
     *
     * @throws IllegalStateException if the set is already full
     */
    public RoleSet with(Role role) {
        if (isFull()) {
            throw new IllegalStateException("Role set is full: " + roles);
        }
        List<Role> updated = new ArrayList<>(roles);
        updated.add(role);
        return new RoleSet(updated);
    }

    /**
     * Create a copy with every occurrence of the role removed.
     */
    public RoleSet without(Role role) {
        if (!roles.contains(role)) {
            return this;
        }
        return new RoleSet(roles.stream().filter(r -> r != role).toList());
    }
}
