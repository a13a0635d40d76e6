package com.trackinglog.api.rest;

import com.trackinglog.core.model.DeliveryRecord;
import com.trackinglog.core.model.EventLogEntry;
import com.trackinglog.core.model.PayloadFingerprint;
import com.trackinglog.core.model.Role;
import com.trackinglog.core.model.RoleSet;
import com.trackinglog.engine.registry.RoleRegistry;
import com.trackinglog.engine.service.DeliveryLedgerService;
import com.trackinglog.engine.service.DeliveryLedgerService.InitializeDeliveryRequest;
import com.trackinglog.engine.service.DeliveryLedgerService.LogEventRequest;
import com.trackinglog.engine.service.DeliveryLedgerService.LogFailureRequest;
import com.trackinglog.engine.service.DeliveryQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for delivery records, event logs and per-delivery roles.
 */
@RestController
@RequestMapping("/api/v1/deliveries")
public class DeliveryController {

    private final DeliveryLedgerService ledgerService;
    private final DeliveryQueryService queryService;
    private final RoleRegistry roleRegistry;

    public DeliveryController(
            DeliveryLedgerService ledgerService,
            DeliveryQueryService queryService,
            RoleRegistry roleRegistry) {
        this.ledgerService = ledgerService;
        this.queryService = queryService;
        this.roleRegistry = roleRegistry;
    }

    /**
     * Initialize a delivery.
     */
    @PostMapping
    public ResponseEntity<DeliveryRecord> initializeDelivery(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @RequestBody InitializeDeliveryDto request) {

        ledgerService.initializeDelivery(new InitializeDeliveryRequest(
            caller,
            request.deliveryId(),
            request.operator(),
            request.supplier(),
            request.recipient(),
            request.expectedArrival(),
            request.payloadFingerprint()
        ));

        return queryService.getDeliveryDetails(request.deliveryId())
            .map(record -> ResponseEntity.status(HttpStatus.CREATED).body(record))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.CREATED).build());
    }

    /**
     * Get delivery details.
     */
    @GetMapping("/{deliveryId}")
    public ResponseEntity<DeliveryRecord> getDelivery(@PathVariable long deliveryId) {
        return ResponseEntity.of(queryService.getDeliveryDetails(deliveryId));
    }

    /**
     * Append an event log entry.
     */
    @PostMapping("/{deliveryId}/events")
    public ResponseEntity<Map<String, Object>> logEvent(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable long deliveryId,
            @RequestBody LogEventDto request) {

        long sequence = ledgerService.logEvent(new LogEventRequest(
            caller,
            deliveryId,
            request.latitude(),
            request.longitude(),
            request.altitude(),
            request.status(),
            request.note()
        ));

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "deliveryId", deliveryId,
            "sequence", sequence
        ));
    }

    /**
     * Get the full event history.
     */
    @GetMapping("/{deliveryId}/events")
    public ResponseEntity<List<EventLogEntry>> getEventHistory(@PathVariable long deliveryId) {
        return ResponseEntity.ok(queryService.getEventHistory(deliveryId));
    }

    /**
     * Get one event log entry.
     */
    @GetMapping("/{deliveryId}/events/{sequence}")
    public ResponseEntity<EventLogEntry> getEvent(
            @PathVariable long deliveryId,
            @PathVariable long sequence) {
        return ResponseEntity.of(queryService.getEventLog(deliveryId, sequence));
    }

    /**
     * Force a delivery into failed state.
     */
    @PostMapping("/{deliveryId}/failure")
    public ResponseEntity<DeliveryRecord> logFailure(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable long deliveryId,
            @RequestBody FailureDto request) {

        ledgerService.logFailure(new LogFailureRequest(caller, deliveryId, request.reason()));
        return ResponseEntity.of(queryService.getDeliveryDetails(deliveryId));
    }

    @GetMapping("/{deliveryId}/sequence")
    public ResponseEntity<Map<String, Object>> getLatestSequence(@PathVariable long deliveryId) {
        return ResponseEntity.ok(Map.of(
            "deliveryId", deliveryId,
            "sequence", queryService.getLatestSequence(deliveryId)
        ));
    }

    @GetMapping("/{deliveryId}/completed")
    public ResponseEntity<Map<String, Object>> isCompleted(@PathVariable long deliveryId) {
        return ResponseEntity.ok(Map.of(
            "deliveryId", deliveryId,
            "completed", queryService.isDeliveryCompleted(deliveryId)
        ));
    }

    /**
     * Grant a role for this delivery.
     */
    @PostMapping("/{deliveryId}/roles")
    public ResponseEntity<RolesResponse> assignRole(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable long deliveryId,
            @RequestBody RoleAssignmentDto request) {

        roleRegistry.assignRole(caller, request.user(), deliveryId, Role.fromCode(request.role()));
        return ResponseEntity.ok(rolesOf(request.user(), deliveryId));
    }

    /**
     * Revoke a role for this delivery.
     */
    @DeleteMapping("/{deliveryId}/roles/{user}/{role}")
    public ResponseEntity<RolesResponse> removeRole(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable long deliveryId,
            @PathVariable String user,
            @PathVariable int role) {

        roleRegistry.removeRole(caller, user, deliveryId, Role.fromCode(role));
        return ResponseEntity.ok(rolesOf(user, deliveryId));
    }

    /**
     * Roles of a user, with the effective check per role (owner bypass included).
     */
    @GetMapping("/{deliveryId}/roles/{user}")
    public ResponseEntity<RolesResponse> getRoles(
            @PathVariable long deliveryId,
            @PathVariable String user) {
        return ResponseEntity.ok(rolesOf(user, deliveryId));
    }

    private RolesResponse rolesOf(String user, long deliveryId) {
        RoleSet roles = queryService.getRoles(user, deliveryId);
        Map<Role, Boolean> effective = new LinkedHashMap<>();
        Arrays.stream(Role.values())
            .forEach(role -> effective.put(role, queryService.hasRole(user, deliveryId, role)));
        return new RolesResponse(user, deliveryId, roles.roles(), effective);
    }

    // ========== DTOs ==========

    public record InitializeDeliveryDto(
        long deliveryId,
        String operator,
        String supplier,
        String recipient,
        long expectedArrival,
        PayloadFingerprint payloadFingerprint
    ) {}

    public record LogEventDto(
        String latitude,
        String longitude,
        long altitude,
        String status,
        String note
    ) {}

    public record FailureDto(String reason) {}

    public record RoleAssignmentDto(String user, int role) {}

    public record RolesResponse(
        String user,
        long deliveryId,
        List<Role> assigned,
        Map<Role, Boolean> effective
    ) {}
}
