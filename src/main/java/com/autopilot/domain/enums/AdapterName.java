package com.autopilot.domain.enums;

/** External collaborators whose connectivity is tracked on the health surface. */
public enum AdapterName {
    BROKER,
    MARKET_DATA,
    CANDIDATES,
    PERSISTENCE,
    NOTIFICATION,
    BACKTEST
}
