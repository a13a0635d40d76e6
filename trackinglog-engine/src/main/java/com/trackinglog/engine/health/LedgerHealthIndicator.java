package com.trackinglog.engine.health;

import com.trackinglog.core.repository.DeliveryRecordRepository;
import com.trackinglog.engine.lock.DeliveryLockManager;
import com.trackinglog.engine.registry.AdminControl;
import com.trackinglog.engine.registry.OracleRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicator for the ledger.
 * Reports OUT_OF_SERVICE while paused, since writes are rejected.
 */
@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final AdminControl adminControl;
    private final OracleRegistry oracleRegistry;
    private final DeliveryRecordRepository recordRepository;
    private final DeliveryLockManager lockManager;

    public LedgerHealthIndicator(
            AdminControl adminControl,
            OracleRegistry oracleRegistry,
            DeliveryRecordRepository recordRepository,
            DeliveryLockManager lockManager) {
        this.adminControl = adminControl;
        this.oracleRegistry = oracleRegistry;
        this.recordRepository = recordRepository;
        this.lockManager = lockManager;
    }

    @Override
    public Health health() {
        Health.Builder builder = adminControl.isPaused() ? Health.outOfService() : Health.up();
        return builder
            .withDetail("paused", adminControl.isPaused())
            .withDetail("oracles", oracleRegistry.oracles().size())
            .withDetail("deliveries", recordRepository.count())
            .withDetail("activeLocks", lockManager.activeLocks())
            .build();
    }
}
