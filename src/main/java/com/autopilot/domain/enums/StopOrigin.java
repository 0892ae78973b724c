package com.autopilot.domain.enums;

/** Who asked for an emergency stop. */
public enum StopOrigin {
    DASHBOARD,
    OPERATOR_CLI,
    CIRCUIT_BREAKER,
    SHUTDOWN
}
