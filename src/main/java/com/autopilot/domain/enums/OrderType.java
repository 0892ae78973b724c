package com.autopilot.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
