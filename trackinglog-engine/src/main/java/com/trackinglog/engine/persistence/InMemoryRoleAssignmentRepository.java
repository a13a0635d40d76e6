package com.trackinglog.engine.persistence;

import com.trackinglog.core.model.RoleAssignment;
import com.trackinglog.core.repository.RoleAssignmentRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of RoleAssignmentRepository.
 */
@Repository
public class InMemoryRoleAssignmentRepository implements RoleAssignmentRepository {

    private final Map<AssignmentKey, RoleAssignment> assignments = new ConcurrentHashMap<>();

    @Override
    public void save(RoleAssignment assignment) {
        assignments.put(new AssignmentKey(assignment.userIdentity(), assignment.deliveryId()), assignment);
    }

    @Override
    public Optional<RoleAssignment> find(String userIdentity, long deliveryId) {
        return Optional.ofNullable(assignments.get(new AssignmentKey(userIdentity, deliveryId)));
    }

    private record AssignmentKey(String userIdentity, long deliveryId) {}
}
