package com.autopilot.domain.model;

import com.autopilot.domain.enums.StopOrigin;
import java.time.Instant;
import lombok.Value;

/** Consumed once by the scheduler, which latches every breaker OPEN and stops the loop. */
@Value
public class EmergencyStopRequest {

    String reason;
    StopOrigin origin;
    Instant requestedAt;
}
