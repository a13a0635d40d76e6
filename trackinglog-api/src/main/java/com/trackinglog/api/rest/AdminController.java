package com.trackinglog.api.rest;

import com.trackinglog.engine.registry.AdminControl;
import com.trackinglog.engine.registry.OracleRegistry;
import com.trackinglog.engine.service.DeliveryQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the oracle registry and the global pause switch.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final AdminControl adminControl;
    private final OracleRegistry oracleRegistry;
    private final DeliveryQueryService queryService;

    public AdminController(
            AdminControl adminControl,
            OracleRegistry oracleRegistry,
            DeliveryQueryService queryService) {
        this.adminControl = adminControl;
        this.oracleRegistry = oracleRegistry;
        this.queryService = queryService;
    }

    @GetMapping("/oracles")
    public ResponseEntity<List<String>> getOracles() {
        return ResponseEntity.ok(queryService.getOracles());
    }

    @PostMapping("/oracles")
    public ResponseEntity<List<String>> addOracle(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @RequestBody OracleDto request) {
        oracleRegistry.addOracle(caller, request.identity());
        return ResponseEntity.ok(queryService.getOracles());
    }

    @DeleteMapping("/oracles/{identity}")
    public ResponseEntity<List<String>> removeOracle(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable String identity) {
        oracleRegistry.removeOracle(caller, identity);
        return ResponseEntity.ok(queryService.getOracles());
    }

    @PostMapping("/pause")
    public ResponseEntity<StatusResponse> pause(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller) {
        adminControl.pause(caller);
        return ResponseEntity.ok(status());
    }

    @PostMapping("/unpause")
    public ResponseEntity<StatusResponse> unpause(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller) {
        adminControl.unpause(caller);
        return ResponseEntity.ok(status());
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> getStatus() {
        return ResponseEntity.ok(status());
    }

    private StatusResponse status() {
        return new StatusResponse(queryService.getOwner(), queryService.isPaused());
    }

    // ========== DTOs ==========

    public record OracleDto(String identity) {}

    public record StatusResponse(String owner, boolean paused) {}
}
