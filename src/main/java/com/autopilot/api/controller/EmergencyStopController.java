package com.autopilot.api.controller;

import com.autopilot.api.dto.request.EmergencyStopRequestDto;
import com.autopilot.api.dto.response.EmergencyStopResponse;
import com.autopilot.core.engine.EmergencyStopSignal;
import com.autopilot.domain.enums.StopOrigin;
import com.autopilot.domain.model.EmergencyStopRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /emergency-stop. Only raises the stop signal; the scheduling loop latches the breakers and
 * winds down on its own thread. Repeated calls are acknowledged without creating a new request.
 */
@RestController
public class EmergencyStopController {

    private static final Logger log = LoggerFactory.getLogger(EmergencyStopController.class);

    private final EmergencyStopSignal emergencyStopSignal;

    public EmergencyStopController(EmergencyStopSignal emergencyStopSignal) {
        this.emergencyStopSignal = emergencyStopSignal;
    }

    @PostMapping("/emergency-stop")
    public ResponseEntity<EmergencyStopResponse> triggerEmergencyStop(
            @Valid @RequestBody EmergencyStopRequestDto request) {
        StopOrigin origin = request.getOrigin() != null ? request.getOrigin() : StopOrigin.DASHBOARD;
        log.error("EMERGENCY STOP REQUESTED via API ({}): {}", origin, request.getReason());

        boolean first = emergencyStopSignal.trigger(request.getReason(), origin);
        EmergencyStopRequest pending = emergencyStopSignal.current().orElseThrow();
        return ResponseEntity.ok(EmergencyStopResponse.builder()
                .acknowledged(true)
                .firstRequest(first)
                .reason(pending.getReason())
                .origin(pending.getOrigin().name())
                .requestedAt(pending.getRequestedAt())
                .build());
    }
}
