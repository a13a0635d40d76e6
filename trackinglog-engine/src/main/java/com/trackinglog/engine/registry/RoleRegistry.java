package com.trackinglog.engine.registry;

import com.trackinglog.core.exception.NotFoundException;
import com.trackinglog.core.exception.RoleCapacityExceededException;
import com.trackinglog.core.exception.UnauthorizedException;
import com.trackinglog.core.model.LedgerLimits;
import com.trackinglog.core.model.Role;
import com.trackinglog.core.model.RoleAssignment;
import com.trackinglog.core.model.RoleSet;
import com.trackinglog.core.repository.DeliveryRecordRepository;
import com.trackinglog.core.repository.RoleAssignmentRepository;
import com.trackinglog.engine.lock.DeliveryLockManager;
import com.trackinglog.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-(user, delivery) capability sets.
 * The global owner passes every role check.
 *
 * Role mutations are not gated by the pause flag.
 */
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final RoleAssignmentRepository assignmentRepository;
    private final DeliveryRecordRepository recordRepository;
    private final AdminControl adminControl;
    private final DeliveryLockManager lockManager;

    public RoleRegistry(
            RoleAssignmentRepository assignmentRepository,
            DeliveryRecordRepository recordRepository,
            AdminControl adminControl,
            DeliveryLockManager lockManager) {
        this.assignmentRepository = assignmentRepository;
        this.recordRepository = recordRepository;
        this.adminControl = adminControl;
        this.lockManager = lockManager;
    }

    /**
     * True iff the user is the global owner or holds the role for the delivery.
     * Does not take the delivery lock; callers needing a consistent view hold it.
     */
    public boolean hasRole(String user, long deliveryId, Role role) {
        if (adminControl.isOwner(user)) {
            return true;
        }
        return rolesOf(user, deliveryId).contains(role);
    }

    /**
     * Roles explicitly assigned to the user. Owner bypass is not reflected here.
     */
    public RoleSet rolesOf(String user, long deliveryId) {
        return assignmentRepository.find(user, deliveryId)
            .map(RoleAssignment::roles)
            .orElse(RoleSet.empty());
    }

    /**
     * Grant a role. Caller must hold admin for the delivery.
     */
    public void assignRole(String caller, String user, long deliveryId, Role role) {
        try (var ctx = LoggingContext.forDelivery(deliveryId, caller)) {
            lockManager.runWithLock(deliveryId, () -> {
                requireAdmin(caller, deliveryId, "assign roles");

                RoleAssignment assignment = assignmentRepository.find(user, deliveryId)
                    .orElseGet(() -> RoleAssignment.empty(user, deliveryId));
                if (assignment.roles().isFull()) {
                    log.warn("Role set full for {}, rejected {}", user, role);
                    throw new RoleCapacityExceededException(user, deliveryId, LedgerLimits.MAX_ROLES_PER_ASSIGNMENT);
                }

                grant(user, deliveryId, role);
                log.info("Assigned {} to {}", role, user);
            });
        }
    }

    /**
     * Revoke a role. Revoking a role the user does not hold is a no-op.
     */
    public void removeRole(String caller, String user, long deliveryId, Role role) {
        try (var ctx = LoggingContext.forDelivery(deliveryId, caller)) {
            lockManager.runWithLock(deliveryId, () -> {
                requireAdmin(caller, deliveryId, "remove roles");

                assignmentRepository.find(user, deliveryId).ifPresent(assignment -> {
                    assignmentRepository.save(assignment.withRoles(assignment.roles().without(role)));
                    log.info("Removed {} from {}", role, user);
                });
            });
        }
    }

    /**
     * Record the initial roles of a new delivery: creator as admin, then operator, supplier
     * and recipient. Each slot replaces the identity's role set, so an identity filling
     * several slots keeps only the role of the last one.
     * Must run under the delivery lock, before the delivery record becomes visible.
     */
    public void grantInitialRoles(long deliveryId, String creator, String operator, String supplier, String recipient) {
        if (!lockManager.isHeldByCurrentThread(deliveryId)) {
            throw new IllegalStateException("Initial roles must be granted under the delivery lock: " + deliveryId);
        }
        replaceRoles(creator, deliveryId, Role.ADMIN);
        replaceRoles(operator, deliveryId, Role.OPERATOR);
        replaceRoles(supplier, deliveryId, Role.SUPPLIER);
        replaceRoles(recipient, deliveryId, Role.RECIPIENT);
    }

    private void replaceRoles(String user, long deliveryId, Role role) {
        assignmentRepository.save(new RoleAssignment(user, deliveryId, RoleSet.of(role)));
    }

    private void grant(String user, long deliveryId, Role role) {
        RoleAssignment assignment = assignmentRepository.find(user, deliveryId)
            .orElseGet(() -> RoleAssignment.empty(user, deliveryId));
        assignmentRepository.save(assignment.withRoles(assignment.roles().with(role)));
    }

    private void requireAdmin(String caller, long deliveryId, String action) {
        if (!recordRepository.existsById(deliveryId)) {
            throw NotFoundException.delivery(deliveryId);
        }
        if (!hasRole(caller, deliveryId, Role.ADMIN)) {
            log.warn("Rejected attempt to {} without admin role", action);
            throw new UnauthorizedException(caller, action + " for delivery " + deliveryId);
        }
    }
}
