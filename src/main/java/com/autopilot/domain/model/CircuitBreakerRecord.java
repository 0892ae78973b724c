package com.autopilot.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Audit record for a breaker trip, reset or emergency stop. */
@Value
@Builder
public class CircuitBreakerRecord {

    String accountId;
    String eventType;
    String haltReason;
    String level;
    String message;
    String details;
    Instant at;
}
