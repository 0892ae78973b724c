package com.autopilot.event;

/** Classifies a {@link RiskEvent}. */
public enum RiskEventType {

    /** An account's breaker moved CLOSED -> OPEN. Published at most once per account per session. */
    CIRCUIT_BREAKER_TRIPPED,

    /** An operator override moved an OPEN breaker back to CLOSED. */
    CIRCUIT_BREAKER_RESET,

    /** The scheduler consumed an emergency stop request. Published once per process. */
    EMERGENCY_STOP,

    /** A new trading date started and per-session counters were cleared. */
    SESSION_RESET
}
