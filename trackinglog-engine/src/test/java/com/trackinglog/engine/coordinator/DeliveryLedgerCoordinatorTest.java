package com.trackinglog.engine.coordinator;

import com.trackinglog.core.exception.*;
import com.trackinglog.core.model.DeliveryRecord;
import com.trackinglog.core.model.DeliveryStatus;
import com.trackinglog.core.model.EventLogEntry;
import com.trackinglog.core.model.Role;
import com.trackinglog.engine.metrics.LedgerMetrics;
import com.trackinglog.engine.service.DeliveryLedgerService.InitializeDeliveryRequest;
import com.trackinglog.engine.service.DeliveryLedgerService.LogEventRequest;
import com.trackinglog.engine.test.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.trackinglog.engine.test.LedgerFixture.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the delivery lifecycle, the event log and their authorization gates.
 */
class DeliveryLedgerCoordinatorTest {

    private LedgerFixture fx;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
    }

    // ========== initializeDelivery ==========

    @Test
    @DisplayName("New delivery starts pending at sequence 0 with the four initial roles")
    void testInitializeDelivery() {
        fx.ledger.initializeDelivery(initRequest(1L));

        DeliveryRecord record = fx.queries.getDeliveryDetails(1L).orElseThrow();
        assertThat(record.status()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(record.operator()).isEqualTo(OPERATOR);
        assertThat(record.supplier()).isEqualTo(SUPPLIER);
        assertThat(record.recipient()).isEqualTo(RECIPIENT);
        assertThat(record.sequence()).isZero();
        assertThat(record.completed()).isFalse();
        assertThat(record.startTime()).isEqualTo(START_TIME);
        assertThat(record.expectedArrival()).isEqualTo(EXPECTED_ARRIVAL);
        assertThat(record.actualArrival()).isNull();
        assertThat(record.payloadFingerprint()).isEqualTo(fingerprint(0xAB));

        assertThat(fx.roleRegistry.rolesOf(CREATOR, 1L).roles()).containsExactly(Role.ADMIN);
        assertThat(fx.roleRegistry.rolesOf(OPERATOR, 1L).roles()).containsExactly(Role.OPERATOR);
        assertThat(fx.roleRegistry.rolesOf(SUPPLIER, 1L).roles()).containsExactly(Role.SUPPLIER);
        assertThat(fx.roleRegistry.rolesOf(RECIPIENT, 1L).roles()).containsExactly(Role.RECIPIENT);
    }

    @Test
    @DisplayName("Second initialization of the same id fails and leaves record and roles untouched")
    void testDuplicateInitialization() {
        fx.initialize(1L);
        fx.ledger.logEvent(event(OPERATOR, 1L, "assigned"));
        DeliveryRecord before = fx.queries.getDeliveryDetails(1L).orElseThrow();

        InitializeDeliveryRequest again = new InitializeDeliveryRequest(
            STRANGER, 1L, STRANGER, STRANGER, STRANGER, 9999L, fingerprint(0x01));

        assertThatThrownBy(() -> fx.ledger.initializeDelivery(again))
            .isInstanceOf(AlreadyInitializedException.class)
            .hasFieldOrPropertyWithValue("errorCode", "ALREADY_INITIALIZED");

        assertThat(fx.queries.getDeliveryDetails(1L)).contains(before);
        assertThat(fx.roleRegistry.rolesOf(STRANGER, 1L).roles()).isEmpty();
    }

    @Test
    @DisplayName("Already-initialized is reported before paused")
    void testAlreadyInitializedPrecedesPaused() {
        fx.initialize(1L);
        fx.adminControl.pause(OWNER);

        assertThatThrownBy(() -> fx.initialize(1L)).isInstanceOf(AlreadyInitializedException.class);
        assertThatThrownBy(() -> fx.initialize(2L)).isInstanceOf(PausedException.class);
        assertThat(fx.recordRepository.existsById(2L)).isFalse();
        assertThat(fx.roleRegistry.rolesOf(CREATOR, 2L).roles()).isEmpty();
    }

    @Test
    @DisplayName("A creator who is also the operator keeps only the operator role")
    void testCreatorAlsoOperator() {
        fx.ledger.initializeDelivery(new InitializeDeliveryRequest(
            OPERATOR, 5L, OPERATOR, SUPPLIER, RECIPIENT, EXPECTED_ARRIVAL, fingerprint(1)));

        assertThat(fx.roleRegistry.rolesOf(OPERATOR, 5L).roles()).containsExactly(Role.OPERATOR);
        assertThat(fx.roleRegistry.hasRole(OPERATOR, 5L, Role.ADMIN)).isFalse();
        assertThatThrownBy(() -> fx.roleRegistry.assignRole(OPERATOR, STRANGER, 5L, Role.OPERATOR))
            .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("An identity filling several slots keeps the role of the last slot")
    void testOverlappingParties() {
        fx.ledger.initializeDelivery(new InitializeDeliveryRequest(
            OPERATOR, 6L, OPERATOR, SUPPLIER, OPERATOR, EXPECTED_ARRIVAL, fingerprint(1)));

        assertThat(fx.roleRegistry.rolesOf(OPERATOR, 6L).roles()).containsExactly(Role.RECIPIENT);
        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 6L, "in-transit")))
            .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("Invalid initialization input is rejected without creating anything")
    void testInitializationValidation() {
        assertThatThrownBy(() -> fx.ledger.initializeDelivery(new InitializeDeliveryRequest(
            CREATOR, 1L, "", SUPPLIER, RECIPIENT, EXPECTED_ARRIVAL, fingerprint(1))))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("operator");

        assertThatThrownBy(() -> fx.ledger.initializeDelivery(new InitializeDeliveryRequest(
            CREATOR, 1L, OPERATOR, SUPPLIER, RECIPIENT, -1L, fingerprint(1))))
            .isInstanceOf(InvalidInputException.class);

        assertThatThrownBy(() -> fx.ledger.initializeDelivery(new InitializeDeliveryRequest(
            CREATOR, 1L, OPERATOR, SUPPLIER, RECIPIENT, EXPECTED_ARRIVAL, null)))
            .isInstanceOf(InvalidInputException.class);

        assertThat(fx.recordRepository.count()).isZero();
        assertThat(fx.roleRegistry.rolesOf(CREATOR, 1L).roles()).isEmpty();
    }

    // ========== logEvent ==========

    @Test
    @DisplayName("In-transit then delivered: sequences 1 and 2, completion stamps arrival, third call rejected")
    void testDeliveryScenario() {
        fx.initialize(1L);

        fx.clock.advance(10);
        long first = fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "40.7", "-74.0", 100L, "in-transit", "started"));
        assertThat(first).isEqualTo(1L);
        DeliveryRecord inTransit = fx.queries.getDeliveryDetails(1L).orElseThrow();
        assertThat(inTransit.status()).isEqualTo(DeliveryStatus.IN_TRANSIT);
        assertThat(inTransit.completed()).isFalse();

        fx.clock.advance(10);
        long second = fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "40.8", "-74.1", 0L, "delivered", "handover"));
        assertThat(second).isEqualTo(2L);
        DeliveryRecord delivered = fx.queries.getDeliveryDetails(1L).orElseThrow();
        assertThat(delivered.completed()).isTrue();
        assertThat(delivered.status()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(delivered.actualArrival()).isEqualTo(START_TIME + 20);

        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 1L, "arrived")))
            .isInstanceOf(AlreadyCompletedException.class);
        assertThat(fx.queries.getLatestSequence(1L)).isEqualTo(2L);
        assertThat(fx.queries.getEventLog(1L, 3L)).isEmpty();
    }

    @Test
    @DisplayName("Event entries carry time, location, updater and note")
    void testEventEntryContents() {
        fx.initialize(1L);
        fx.clock.advance(3);

        fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "40.7128", "-74.0060", 100L, "in-transit", "Flight started"));

        EventLogEntry entry = fx.queries.getEventLog(1L, 1L).orElseThrow();
        assertThat(entry.logicalTime()).isEqualTo(START_TIME + 3);
        assertThat(entry.latitude()).isEqualTo("40.7128");
        assertThat(entry.longitude()).isEqualTo("-74.0060");
        assertThat(entry.altitude()).isEqualTo(100L);
        assertThat(entry.status()).isEqualTo(DeliveryStatus.IN_TRANSIT);
        assertThat(entry.updater()).isEqualTo(OPERATOR);
        assertThat(entry.note()).isEqualTo("Flight started");
        assertThat(entry.oracleVerified()).isFalse();
    }

    @Test
    @DisplayName("Unregistered caller is rejected; after oracle registration the retry is verified")
    void testOracleScenario() {
        fx.initialize(1L);

        assertThatThrownBy(() -> fx.ledger.logEvent(event(ORACLE, 1L, "in-transit")))
            .isInstanceOf(UnauthorizedException.class);
        assertThat(fx.queries.getLatestSequence(1L)).isZero();

        fx.oracleRegistry.addOracle(OWNER, ORACLE);

        long sequence = fx.ledger.logEvent(event(ORACLE, 1L, "in-transit"));
        assertThat(sequence).isEqualTo(1L);
        assertThat(fx.queries.getEventLog(1L, 1L).orElseThrow().oracleVerified()).isTrue();
    }

    @Test
    @DisplayName("An operator who is also an oracle writes verified entries")
    void testOperatorInOracleRegistry() {
        fx.initialize(1L);
        fx.oracleRegistry.addOracle(OWNER, OPERATOR);

        fx.ledger.logEvent(event(OPERATOR, 1L, "assigned"));

        assertThat(fx.queries.getEventLog(1L, 1L).orElseThrow().oracleVerified()).isTrue();
    }

    @Test
    @DisplayName("Owner passes the operator check without holding the role")
    void testOwnerBypass() {
        fx.initialize(1L);

        long sequence = fx.ledger.logEvent(event(OWNER, 1L, "delayed"));

        assertThat(sequence).isEqualTo(1L);
        assertThat(fx.queries.getEventLog(1L, 1L).orElseThrow().oracleVerified()).isFalse();
    }

    @Test
    @DisplayName("Supplier, recipient and admin roles cannot log events")
    void testNonOperatorRolesRejected() {
        fx.initialize(1L);

        for (String caller : new String[]{SUPPLIER, RECIPIENT, CREATOR}) {
            assertThatThrownBy(() -> fx.ledger.logEvent(event(caller, 1L, "in-transit")))
                .isInstanceOf(UnauthorizedException.class);
        }
    }

    @Test
    @DisplayName("Unknown delivery is reported as not found")
    void testLogEventUnknownDelivery() {
        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 42L, "in-transit")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Invalid status and empty coordinates are distinct input errors")
    void testInputValidation() {
        fx.initialize(1L);

        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 1L, "lost")))
            .isInstanceOf(InvalidStatusException.class)
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 1L, "IN-TRANSIT")))
            .isInstanceOf(InvalidStatusException.class);
        assertThatThrownBy(() -> fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "", "-74.0", 0L, "in-transit", "")))
            .isInstanceOf(InvalidLocationException.class)
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "40.7", "", 0L, "in-transit", "")))
            .isInstanceOf(InvalidLocationException.class);

        assertThat(fx.queries.getLatestSequence(1L)).isZero();
        assertThat(fx.queries.getEventHistory(1L)).isEmpty();
    }

    @Test
    @DisplayName("Field bounds are enforced before anything is written")
    void testFieldBounds() {
        fx.initialize(1L);

        assertThatThrownBy(() -> fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "4".repeat(33), "-74.0", 0L, "in-transit", "")))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("latitude");
        assertThatThrownBy(() -> fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "40.7", "-74.0", -1L, "in-transit", "")))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("altitude");
        assertThatThrownBy(() -> fx.ledger.logEvent(new LogEventRequest(
            OPERATOR, 1L, "40.7", "-74.0", 0L, "in-transit", "n".repeat(257))))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("note");

        assertThat(fx.queries.getLatestSequence(1L)).isZero();
    }

    @Test
    @DisplayName("Authorization is checked before input validation")
    void testUnauthorizedPrecedesValidation() {
        fx.initialize(1L);

        assertThatThrownBy(() -> fx.ledger.logEvent(new LogEventRequest(
            STRANGER, 1L, "", "", 0L, "bogus", "")))
            .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("Exactly 100 events per delivery; the 101st fails and sequence stops")
    void testLogLimit() {
        fx.initialize(1L);

        for (int i = 1; i <= 100; i++) {
            assertThat(fx.ledger.logEvent(event(OPERATOR, 1L, i % 2 == 0 ? "delayed" : "in-transit")))
                .isEqualTo(i);
        }

        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 1L, "arrived")))
            .isInstanceOf(LogLimitExceededException.class);
        assertThat(fx.queries.getLatestSequence(1L)).isEqualTo(100L);
        assertThat(fx.queries.getEventHistory(1L)).hasSize(100);
        assertThat(fx.queries.getDeliveryDetails(1L).orElseThrow().status()).isEqualTo(DeliveryStatus.DELAYED);

        // A full log does not block a forced failure
        fx.ledger.logFailure(failure(OPERATOR, 1L, "log exhausted"));
        assertThat(fx.queries.isDeliveryCompleted(1L)).isTrue();
    }

    @Test
    @DisplayName("Status order is permissive: stages may be skipped and revisited")
    void testPermissiveTransitions() {
        fx.initialize(1L);

        fx.ledger.logEvent(event(OPERATOR, 1L, "arrived"));
        fx.ledger.logEvent(event(OPERATOR, 1L, "pending"));
        fx.ledger.logEvent(event(OPERATOR, 1L, "pending"));

        assertThat(fx.queries.getDeliveryDetails(1L).orElseThrow().status()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(fx.queries.getLatestSequence(1L)).isEqualTo(3L);
    }

    @Test
    @DisplayName("Failed and cancelled statuses complete the delivery through logEvent too")
    void testTerminalStatusesViaLogEvent() {
        fx.initialize(1L);
        fx.initialize(2L);

        fx.ledger.logEvent(event(OPERATOR, 1L, "failed"));
        fx.ledger.logEvent(event(OPERATOR, 2L, "cancelled"));

        assertThat(fx.queries.isDeliveryCompleted(1L)).isTrue();
        assertThat(fx.queries.isDeliveryCompleted(2L)).isTrue();
        assertThat(fx.queries.getDeliveryDetails(1L).orElseThrow().failureReason()).isNull();
        assertThat(fx.queries.getDeliveryDetails(2L).orElseThrow().actualArrival()).isNotNull();
    }

    // ========== logFailure ==========

    @Test
    @DisplayName("Forced failure completes the delivery without touching the event log")
    void testLogFailure() {
        fx.initialize(1L);
        fx.ledger.logEvent(event(OPERATOR, 1L, "in-transit"));

        fx.ledger.logFailure(failure(OPERATOR, 1L, "Weather issues"));

        DeliveryRecord record = fx.queries.getDeliveryDetails(1L).orElseThrow();
        assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(record.completed()).isTrue();
        assertThat(record.failureReason()).isEqualTo("Weather issues");
        assertThat(record.sequence()).isEqualTo(1L);
        assertThat(record.actualArrival()).isNull();
        assertThat(fx.queries.getEventHistory(1L)).hasSize(1);
    }

    @Test
    @DisplayName("Oracles cannot force failures")
    void testLogFailureOracleRejected() {
        fx.initialize(1L);
        fx.oracleRegistry.addOracle(OWNER, ORACLE);

        assertThatThrownBy(() -> fx.ledger.logFailure(failure(ORACLE, 1L, "bad weather")))
            .isInstanceOf(UnauthorizedException.class);
        assertThat(fx.queries.isDeliveryCompleted(1L)).isFalse();
    }

    @Test
    @DisplayName("Failure without a reason stores an empty reason")
    void testLogFailureWithoutReason() {
        fx.initialize(1L);

        fx.ledger.logFailure(failure(OPERATOR, 1L, null));

        DeliveryRecord record = fx.queries.getDeliveryDetails(1L).orElseThrow();
        assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(record.failureReason()).isEmpty();
        assertThat(record.sequence()).isZero();
    }

    @Test
    @DisplayName("Completed deliveries reject every further logEvent and logFailure")
    void testCompletedIsImmutable() {
        fx.initialize(1L);
        fx.ledger.logFailure(failure(OPERATOR, 1L, "first"));

        assertThatThrownBy(() -> fx.ledger.logFailure(failure(OPERATOR, 1L, "second")))
            .isInstanceOf(AlreadyCompletedException.class);
        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 1L, "delivered")))
            .isInstanceOf(AlreadyCompletedException.class);

        DeliveryRecord record = fx.queries.getDeliveryDetails(1L).orElseThrow();
        assertThat(record.failureReason()).isEqualTo("first");
        assertThat(record.sequence()).isZero();
    }

    @Test
    @DisplayName("Failure checks run in order: not found, paused, completed, unauthorized")
    void testLogFailureCheckOrder() {
        assertThatThrownBy(() -> fx.ledger.logFailure(failure(STRANGER, 9L, "x")))
            .isInstanceOf(NotFoundException.class);

        fx.initialize(1L);
        fx.initialize(2L);
        fx.ledger.logEvent(event(OPERATOR, 2L, "delivered"));
        fx.adminControl.pause(OWNER);
        assertThatThrownBy(() -> fx.ledger.logFailure(failure(STRANGER, 1L, "x")))
            .isInstanceOf(PausedException.class);

        fx.adminControl.unpause(OWNER);
        assertThatThrownBy(() -> fx.ledger.logFailure(failure(STRANGER, 2L, "x")))
            .isInstanceOf(AlreadyCompletedException.class);
        assertThatThrownBy(() -> fx.ledger.logFailure(failure(STRANGER, 1L, "x")))
            .isInstanceOf(UnauthorizedException.class);
    }

    // ========== pause gate ==========

    @Test
    @DisplayName("While paused every gated operation fails for every caller, owner included")
    void testPauseGate() {
        fx.initialize(1L);
        fx.adminControl.pause(OWNER);

        for (String caller : new String[]{OWNER, OPERATOR, STRANGER}) {
            assertThatThrownBy(() -> fx.ledger.initializeDelivery(initRequest(caller, 7L)))
                .isInstanceOf(PausedException.class);
            assertThatThrownBy(() -> fx.ledger.logEvent(event(caller, 1L, "in-transit")))
                .isInstanceOf(PausedException.class);
            assertThatThrownBy(() -> fx.ledger.logFailure(failure(caller, 1L, "paused")))
                .isInstanceOf(PausedException.class);
        }

        fx.adminControl.unpause(OWNER);
        assertThat(fx.ledger.logEvent(event(OPERATOR, 1L, "in-transit"))).isEqualTo(1L);
    }

    // ========== metrics ==========

    @Test
    @DisplayName("Successful and rejected operations are counted")
    void testMetrics() {
        fx.initialize(1L);
        fx.ledger.logEvent(event(OPERATOR, 1L, "delivered"));
        assertThatThrownBy(() -> fx.ledger.logEvent(event(OPERATOR, 1L, "delivered")))
            .isInstanceOf(AlreadyCompletedException.class);

        assertThat(fx.meterRegistry.get(LedgerMetrics.DELIVERIES_INITIALIZED).counter().count()).isEqualTo(1.0);
        assertThat(fx.meterRegistry.get(LedgerMetrics.EVENTS_LOGGED)
            .tag("status", "delivered").tag("oracle", "false").counter().count()).isEqualTo(1.0);
        assertThat(fx.meterRegistry.get(LedgerMetrics.DELIVERIES_COMPLETED)
            .tag("status", "delivered").counter().count()).isEqualTo(1.0);
        assertThat(fx.meterRegistry.get(LedgerMetrics.OPERATIONS_REJECTED)
            .tag("operation", "logEvent").tag("error", AlreadyCompletedException.ERROR_CODE)
            .counter().count()).isEqualTo(1.0);
    }
}
