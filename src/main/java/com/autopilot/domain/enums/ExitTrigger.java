package com.autopilot.domain.enums;

/**
 * Marks a close as risk-reducing. STOP_LOSS and TAKE_PROFIT closes bypass the
 * PDT, sizing and exposure checks once the trigger condition is verified.
 */
public enum ExitTrigger {
    NONE,
    STOP_LOSS,
    TAKE_PROFIT
}
