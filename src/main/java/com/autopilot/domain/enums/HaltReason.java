package com.autopilot.domain.enums;

/** Why an account's circuit breaker was opened. */
public enum HaltReason {

    /** Daily realized P&L fell to or below the daily loss limit. */
    DAILY_LOSS_LIMIT,

    /** Consecutive losing closes reached the configured maximum. */
    CONSECUTIVE_LOSSES,

    /** Several consecutive cycles failed entirely for the account (adapter outage). */
    SYSTEMIC_FAILURE,

    /** An emergency stop was consumed by the scheduler. */
    EMERGENCY_STOP
}
