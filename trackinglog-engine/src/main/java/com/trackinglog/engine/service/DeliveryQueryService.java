package com.trackinglog.engine.service;

import com.trackinglog.core.exception.NotFoundException;
import com.trackinglog.core.model.DeliveryRecord;
import com.trackinglog.core.model.EventLogEntry;
import com.trackinglog.core.model.Role;
import com.trackinglog.core.model.RoleSet;
import com.trackinglog.core.repository.DeliveryRecordRepository;
import com.trackinglog.core.repository.EventLogRepository;
import com.trackinglog.engine.lock.DeliveryLockManager;
import com.trackinglog.engine.registry.AdminControl;
import com.trackinglog.engine.registry.OracleRegistry;
import com.trackinglog.engine.registry.RoleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Read-only projections over the ledger and its registries.
 * Per-delivery reads take the delivery lock so a half-applied transition is never observed.
 */
public class DeliveryQueryService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryQueryService.class);

    private final DeliveryRecordRepository recordRepository;
    private final EventLogRepository eventLogRepository;
    private final RoleRegistry roleRegistry;
    private final OracleRegistry oracleRegistry;
    private final AdminControl adminControl;
    private final DeliveryLockManager lockManager;

    public DeliveryQueryService(
            DeliveryRecordRepository recordRepository,
            EventLogRepository eventLogRepository,
            RoleRegistry roleRegistry,
            OracleRegistry oracleRegistry,
            AdminControl adminControl,
            DeliveryLockManager lockManager) {
        this.recordRepository = recordRepository;
        this.eventLogRepository = eventLogRepository;
        this.roleRegistry = roleRegistry;
        this.oracleRegistry = oracleRegistry;
        this.adminControl = adminControl;
        this.lockManager = lockManager;
    }

    public Optional<DeliveryRecord> getDeliveryDetails(long deliveryId) {
        log.debug("Fetching delivery {}", deliveryId);
        return lockManager.withLock(deliveryId, () -> recordRepository.findById(deliveryId));
    }

    public Optional<EventLogEntry> getEventLog(long deliveryId, long sequence) {
        log.debug("Fetching event {} of delivery {}", sequence, deliveryId);
        return lockManager.withLock(deliveryId, () -> eventLogRepository.find(deliveryId, sequence));
    }

    /**
     * All entries of a delivery in sequence order. Empty for unknown deliveries.
     */
    public List<EventLogEntry> getEventHistory(long deliveryId) {
        return lockManager.withLock(deliveryId, () -> eventLogRepository.findByDelivery(deliveryId));
    }

    /**
     * @throws NotFoundException if the delivery does not exist
     */
    public long getLatestSequence(long deliveryId) {
        return requireRecord(deliveryId).sequence();
    }

    /**
     * @throws NotFoundException if the delivery does not exist
     */
    public boolean isDeliveryCompleted(long deliveryId) {
        return requireRecord(deliveryId).completed();
    }

    public List<String> getOracles() {
        return oracleRegistry.oracles();
    }

    public boolean isPaused() {
        return adminControl.isPaused();
    }

    public String getOwner() {
        return adminControl.owner();
    }

    public boolean hasRole(String user, long deliveryId, Role role) {
        return lockManager.withLock(deliveryId, () -> roleRegistry.hasRole(user, deliveryId, role));
    }

    public RoleSet getRoles(String user, long deliveryId) {
        return lockManager.withLock(deliveryId, () -> roleRegistry.rolesOf(user, deliveryId));
    }

    private DeliveryRecord requireRecord(long deliveryId) {
        return getDeliveryDetails(deliveryId)
            .orElseThrow(() -> NotFoundException.delivery(deliveryId));
    }
}
