package com.autopilot.api.dto.response;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Acknowledgement of an emergency-stop trigger. {@code firstRequest} is false when a stop was
 * already pending; the fields then describe that earlier request.
 */
@Getter
@Builder
public class EmergencyStopResponse {

    private final boolean acknowledged;
    private final boolean firstRequest;
    private final String reason;
    private final String origin;
    private final Instant requestedAt;
}
