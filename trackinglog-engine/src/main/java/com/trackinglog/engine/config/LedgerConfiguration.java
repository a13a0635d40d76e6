package com.trackinglog.engine.config;

import com.trackinglog.core.repository.DeliveryRecordRepository;
import com.trackinglog.core.repository.EventLogRepository;
import com.trackinglog.core.repository.RoleAssignmentRepository;
import com.trackinglog.core.time.LedgerClock;
import com.trackinglog.engine.coordinator.DeliveryLedgerCoordinator;
import com.trackinglog.engine.lock.DeliveryLockManager;
import com.trackinglog.engine.metrics.LedgerMetrics;
import com.trackinglog.engine.registry.AdminControl;
import com.trackinglog.engine.registry.OracleRegistry;
import com.trackinglog.engine.registry.RoleRegistry;
import com.trackinglog.engine.service.DeliveryLedgerService;
import com.trackinglog.engine.service.DeliveryQueryService;
import com.trackinglog.engine.time.LogicalLedgerClock;
import com.trackinglog.engine.time.WallLedgerClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the ledger components. Global state (owner, pause flag, oracle list) lives
 * in beans created once here and injected where needed.
 *
 * Properties:
 * - trackinglog.owner: global owner identity
 * - trackinglog.clock: logical | wall
 * - trackinglog.clock-genesis: first logical time value
 */
@Configuration
public class LedgerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfiguration.class);

    @Bean
    public AdminControl adminControl(@Value("${trackinglog.owner:deployer}") String owner) {
        log.info("Ledger owner: {}", owner);
        return new AdminControl(owner);
    }

    @Bean
    public OracleRegistry oracleRegistry(AdminControl adminControl) {
        return new OracleRegistry(adminControl);
    }

    @Bean
    public RoleRegistry roleRegistry(
            RoleAssignmentRepository assignmentRepository,
            DeliveryRecordRepository recordRepository,
            AdminControl adminControl,
            DeliveryLockManager lockManager) {
        return new RoleRegistry(assignmentRepository, recordRepository, adminControl, lockManager);
    }

    @Bean
    public LedgerClock ledgerClock(
            @Value("${trackinglog.clock:logical}") String mode,
            @Value("${trackinglog.clock-genesis:1000}") long genesis) {
        return switch (mode) {
            case "logical" -> new LogicalLedgerClock(genesis);
            case "wall" -> new WallLedgerClock(Clock.systemUTC());
            default -> throw new IllegalArgumentException("Unknown trackinglog.clock mode: " + mode);
        };
    }

    @Bean
    public DeliveryLedgerService deliveryLedgerService(
            DeliveryRecordRepository recordRepository,
            EventLogRepository eventLogRepository,
            RoleRegistry roleRegistry,
            OracleRegistry oracleRegistry,
            AdminControl adminControl,
            DeliveryLockManager lockManager,
            LedgerClock ledgerClock,
            LedgerMetrics ledgerMetrics) {
        return new DeliveryLedgerCoordinator(recordRepository, eventLogRepository, roleRegistry,
            oracleRegistry, adminControl, lockManager, ledgerClock, ledgerMetrics);
    }

    @Bean
    public DeliveryQueryService deliveryQueryService(
            DeliveryRecordRepository recordRepository,
            EventLogRepository eventLogRepository,
            RoleRegistry roleRegistry,
            OracleRegistry oracleRegistry,
            AdminControl adminControl,
            DeliveryLockManager lockManager) {
        return new DeliveryQueryService(recordRepository, eventLogRepository, roleRegistry,
            oracleRegistry, adminControl, lockManager);
    }
}
