package com.autopilot.domain.enums;

/**
 * Per-account trading latch. OPEN means trading is halted for the account.
 * Only a session reset or a manual override moves OPEN back to CLOSED.
 */
public enum CircuitBreakerStatus {
    CLOSED,
    OPEN
}
