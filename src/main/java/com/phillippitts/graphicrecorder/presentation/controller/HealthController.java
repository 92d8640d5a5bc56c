package com.phillippitts.graphicrecorder.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Lightweight liveness check for load balancers; detailed state is on /actuator/health.
 */
@RestController
class HealthController {

    private static final Logger log = LogManager.getLogger(HealthController.class);

    private final Clock clock;

    HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/api/health")
    ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", clock.instant().toString()
        ));
    }
}
