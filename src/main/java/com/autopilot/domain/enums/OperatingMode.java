package com.autopilot.domain.enums;

/**
 * What the scheduler does with a cycle.
 * TRADING while the regular session is open, BACKTESTING otherwise.
 */
public enum OperatingMode {
    TRADING,
    BACKTESTING;

    public static OperatingMode forMarket(boolean marketOpen) {
        return marketOpen ? TRADING : BACKTESTING;
    }
}
