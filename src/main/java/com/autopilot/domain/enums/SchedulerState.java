package com.autopilot.domain.enums;

/**
 * Lifecycle of the mode scheduler.
 *
 * <pre>
 * STARTING -> RUNNING -> STOPPING -> STOPPED
 * STARTING -> STOPPED                 (startup validation failed)
 * </pre>
 *
 * <p>The TRADING/BACKTESTING distinction lives in {@link OperatingMode}; RUNNING is the only
 * state in which cycles execute.
 */
public enum SchedulerState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED;

    public boolean canTransitionTo(SchedulerState target) {
        return switch (this) {
            case STARTING -> target == RUNNING || target == STOPPED;
            case RUNNING -> target == STOPPING;
            case STOPPING -> target == STOPPED;
            case STOPPED -> false;
        };
    }

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
