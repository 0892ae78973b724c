package com.autopilot.event;

/**
 * Severity level for a {@link RiskEvent}. CRITICAL is reserved for conditions that halted trading.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
