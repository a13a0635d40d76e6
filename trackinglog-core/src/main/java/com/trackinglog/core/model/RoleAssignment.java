package com.trackinglog.core.model;

/**
 * Roles held by one user for one delivery.
 *
 * Primary Key: (userIdentity, deliveryId). Keys are never deleted; the role set may become empty.
 */
public record RoleAssignment(
    String userIdentity,
    long deliveryId,
    RoleSet roles
) {
    public static RoleAssignment empty(String userIdentity, long deliveryId) {
        return new RoleAssignment(userIdentity, deliveryId, RoleSet.empty());
    }

    public RoleAssignment withRoles(RoleSet newRoles) {
        return new RoleAssignment(userIdentity, deliveryId, newRoles);
    }
}
