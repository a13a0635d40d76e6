package com.trackinglog.core.repository;

import com.trackinglog.core.model.RoleAssignment;
import java.util.Optional;

/**
 * Repository for per-(user, delivery) role assignments.
 */
public interface RoleAssignmentRepository {

    /**
     * Insert or replace the assignment for its (user, delivery) key.
     */
    void save(RoleAssignment assignment);

    /**
     * Find the assignment for a (user, delivery) key.
     *
     * @return The assignment if the key was ever written
     */
    Optional<RoleAssignment> find(String userIdentity, long deliveryId);
}
