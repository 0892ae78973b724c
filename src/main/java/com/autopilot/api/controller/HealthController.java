package com.autopilot.api.controller;

import com.autopilot.api.dto.response.HealthResponse;
import com.autopilot.observability.HealthService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /health. Always answers 200 while the process is up; a failing adapter or a stopped loop
 * shows up in {@code status}, never as an error response.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping
    public ResponseEntity<HealthResponse> getHealth() {
        return ResponseEntity.ok(healthService.getHealth());
    }
}
