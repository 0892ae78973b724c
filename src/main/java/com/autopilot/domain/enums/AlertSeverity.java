package com.autopilot.domain.enums;

/**
 * Severity level for outgoing notifications.
 *
 * <p>CRITICAL covers circuit-breaker trips and emergency stops, WARNING repeated
 * adapter failures, INFO trade and backtest summaries.
 */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO
}
