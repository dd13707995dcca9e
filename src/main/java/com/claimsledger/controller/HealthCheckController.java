package com.claimsledger.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Liveness endpoint. Does not touch the database; use /actuator/health for that.
 */
@RestController
@RequestMapping("/health")
public class HealthCheckController {

    private final Clock clock;

    public HealthCheckController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("application", "Claims Ledger");
        response.put("timestamp", Instant.now(clock));
        return ResponseEntity.ok(response);
    }
}
