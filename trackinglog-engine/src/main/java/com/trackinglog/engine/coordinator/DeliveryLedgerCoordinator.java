package com.trackinglog.engine.coordinator;

import com.trackinglog.core.exception.AlreadyCompletedException;
import com.trackinglog.core.exception.AlreadyInitializedException;
import com.trackinglog.core.exception.InvalidInputException;
import com.trackinglog.core.exception.InvalidLocationException;
import com.trackinglog.core.exception.InvalidStatusException;
import com.trackinglog.core.exception.LedgerException;
import com.trackinglog.core.exception.LogLimitExceededException;
import com.trackinglog.core.exception.NotFoundException;
import com.trackinglog.core.exception.UnauthorizedException;
import com.trackinglog.core.model.DeliveryRecord;
import com.trackinglog.core.model.DeliveryStatus;
import com.trackinglog.core.model.EventLogEntry;
import com.trackinglog.core.model.LedgerLimits;
import com.trackinglog.core.model.Role;
import com.trackinglog.core.repository.DeliveryRecordRepository;
import com.trackinglog.core.repository.EventLogRepository;
import com.trackinglog.core.time.LedgerClock;
import com.trackinglog.engine.lock.DeliveryLockManager;
import com.trackinglog.engine.logging.LoggingContext;
import com.trackinglog.engine.metrics.LedgerMetrics;
import com.trackinglog.engine.registry.AdminControl;
import com.trackinglog.engine.registry.OracleRegistry;
import com.trackinglog.engine.registry.RoleRegistry;
import com.trackinglog.engine.service.DeliveryLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Owns delivery records and their event logs.
 * Consults AdminControl for the pause gate and RoleRegistry/OracleRegistry for
 * authorization, then mutates under the delivery lock.
 *
 * Check order per operation is fixed; all checks run before the first write.
 */
public class DeliveryLedgerCoordinator implements DeliveryLedgerService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryLedgerCoordinator.class);

    private final DeliveryRecordRepository recordRepository;
    private final EventLogRepository eventLogRepository;
    private final RoleRegistry roleRegistry;
    private final OracleRegistry oracleRegistry;
    private final AdminControl adminControl;
    private final DeliveryLockManager lockManager;
    private final LedgerClock clock;
    private final LedgerMetrics metrics;

    public DeliveryLedgerCoordinator(
            DeliveryRecordRepository recordRepository,
            EventLogRepository eventLogRepository,
            RoleRegistry roleRegistry,
            OracleRegistry oracleRegistry,
            AdminControl adminControl,
            DeliveryLockManager lockManager,
            LedgerClock clock,
            LedgerMetrics metrics) {
        this.recordRepository = recordRepository;
        this.eventLogRepository = eventLogRepository;
        this.roleRegistry = roleRegistry;
        this.oracleRegistry = oracleRegistry;
        this.adminControl = adminControl;
        this.lockManager = lockManager;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public void initializeDelivery(InitializeDeliveryRequest request) {
        long deliveryId = request.deliveryId();
        try (var ctx = LoggingContext.forDelivery(deliveryId, request.caller())) {
            lockManager.runWithLock(deliveryId, () -> tracked("initializeDelivery", () -> {
                if (recordRepository.existsById(deliveryId)) {
                    throw new AlreadyInitializedException(deliveryId);
                }
                adminControl.requireNotPaused();
                validateInitialization(request);

                long now = clock.now();
                DeliveryRecord record = DeliveryRecord.create(
                    deliveryId,
                    request.operator(),
                    request.supplier(),
                    request.recipient(),
                    now,
                    request.expectedArrival(),
                    request.payloadFingerprint()
                );

                // Roles first: the record is what makes the delivery visible
                roleRegistry.grantInitialRoles(deliveryId, request.caller(),
                    request.operator(), request.supplier(), request.recipient());
                recordRepository.save(record);

                metrics.deliveryInitialized();
                log.info("Initialized delivery: operator={}, supplier={}, recipient={}, expectedArrival={}",
                    request.operator(), request.supplier(), request.recipient(), request.expectedArrival());
                return null;
            }));
        }
    }

    @Override
    public long logEvent(LogEventRequest request) {
        long deliveryId = request.deliveryId();
        String caller = request.caller();
        try (var ctx = LoggingContext.forDelivery(deliveryId, caller)) {
            return lockManager.withLock(deliveryId, () -> tracked("logEvent", () -> {
                DeliveryRecord record = getOpenRecord(deliveryId);

                boolean oracleVerified = oracleRegistry.isOracle(caller);
                if (!roleRegistry.hasRole(caller, deliveryId, Role.OPERATOR) && !oracleVerified) {
                    throw new UnauthorizedException(caller, "log events for delivery " + deliveryId);
                }

                DeliveryStatus status = DeliveryStatus.fromWireValue(request.status())
                    .orElseThrow(() -> new InvalidStatusException(request.status()));
                validateLocation(request.latitude(), request.longitude());
                validateEventFields(request);

                if (record.sequence() >= LedgerLimits.MAX_LOG_ENTRIES_PER_DELIVERY) {
                    throw new LogLimitExceededException(deliveryId, LedgerLimits.MAX_LOG_ENTRIES_PER_DELIVERY);
                }

                long now = clock.now();
                long newSequence = record.sequence() + 1;
                EventLogEntry entry = new EventLogEntry(
                    deliveryId,
                    newSequence,
                    now,
                    request.latitude(),
                    request.longitude(),
                    request.altitude(),
                    status,
                    caller,
                    request.note() != null ? request.note() : "",
                    oracleVerified
                );
                DeliveryRecord updated = record.withEvent(status, newSequence, now);

                eventLogRepository.append(entry);
                recordRepository.update(updated);

                metrics.eventLogged(status, oracleVerified);
                log.info("Logged event {}: status={}, oracleVerified={}", newSequence, status, oracleVerified);
                if (updated.completed()) {
                    log.info("Delivery completed with status {} at {}", status, now);
                }
                return newSequence;
            }));
        }
    }

    @Override
    public void logFailure(LogFailureRequest request) {
        long deliveryId = request.deliveryId();
        String caller = request.caller();
        try (var ctx = LoggingContext.forDelivery(deliveryId, caller)) {
            lockManager.runWithLock(deliveryId, () -> tracked("logFailure", () -> {
                DeliveryRecord record = getOpenRecord(deliveryId);

                // Oracles cannot force failures
                if (!roleRegistry.hasRole(caller, deliveryId, Role.OPERATOR)) {
                    throw new UnauthorizedException(caller, "log failure for delivery " + deliveryId);
                }
                String failureReason = request.reason() != null ? request.reason() : "";
                requireMaxLength("reason", failureReason, LedgerLimits.MAX_REASON_LENGTH);

                recordRepository.update(record.withFailure(failureReason));

                metrics.failureForced();
                log.info("Delivery failed: {}", failureReason);
                return null;
            }));
        }
    }

    // ========== Internal Methods ==========

    /**
     * Shared gate of logEvent and logFailure: exists, not paused, not completed.
     */
    private DeliveryRecord getOpenRecord(long deliveryId) {
        DeliveryRecord record = recordRepository.findById(deliveryId)
            .orElseThrow(() -> NotFoundException.delivery(deliveryId));
        adminControl.requireNotPaused();
        if (record.completed()) {
            throw new AlreadyCompletedException(deliveryId, record.status());
        }
        return record;
    }

    private <T> T tracked(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (LedgerException e) {
            metrics.operationRejected(operation, e.getErrorCode());
            log.warn("Rejected {}: {}", operation, e.getMessage());
            throw e;
        }
    }

    private void validateInitialization(InitializeDeliveryRequest request) {
        if (request.deliveryId() < 0) {
            throw new InvalidInputException("deliveryId", "must be non-negative");
        }
        requireIdentity("caller", request.caller());
        requireIdentity("operator", request.operator());
        requireIdentity("supplier", request.supplier());
        requireIdentity("recipient", request.recipient());
        if (request.expectedArrival() < 0) {
            throw new InvalidInputException("expectedArrival", "must be non-negative");
        }
        if (request.payloadFingerprint() == null) {
            throw new InvalidInputException("payloadFingerprint", "cannot be null");
        }
    }

    private void validateLocation(String latitude, String longitude) {
        if (latitude == null || latitude.isEmpty()) {
            throw new InvalidLocationException("latitude");
        }
        if (longitude == null || longitude.isEmpty()) {
            throw new InvalidLocationException("longitude");
        }
    }

    private void validateEventFields(LogEventRequest request) {
        requireMaxLength("latitude", request.latitude(), LedgerLimits.MAX_COORDINATE_LENGTH);
        requireMaxLength("longitude", request.longitude(), LedgerLimits.MAX_COORDINATE_LENGTH);
        if (request.altitude() < 0) {
            throw new InvalidInputException("altitude", "must be non-negative");
        }
        if (request.note() != null) {
            requireMaxLength("note", request.note(), LedgerLimits.MAX_NOTE_LENGTH);
        }
    }

    private static void requireIdentity(String field, String identity) {
        if (identity == null || identity.isBlank()) {
            throw new InvalidInputException(field, "cannot be empty");
        }
        requireMaxLength(field, identity, LedgerLimits.MAX_IDENTITY_LENGTH);
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value.length() > maxLength) {
            throw new InvalidInputException(field, "longer than " + maxLength + " characters");
        }
    }
}
