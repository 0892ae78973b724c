package com.autopilot.domain.enums;

/**
 * Broker wiring. PAPER uses the in-memory simulator; LIVE requires an externally
 * supplied broker adapter and credentials for every account.
 */
public enum TradingMode {
    LIVE,
    PAPER
}
