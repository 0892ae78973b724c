package com.autopilot.domain.enums;

/** How far an account got through a trading cycle. */
public enum AccountStepStatus {

    /** All steps ran (individual orders may still have been rejected or failed). */
    COMPLETED,

    /** The circuit breaker was OPEN; only refresh and reporting ran. */
    HALTED,

    /** The account step failed before reaching order evaluation. */
    FAILED,

    /** An emergency stop was observed between steps. */
    CANCELLED
}
