package com.autopilot.domain.enums;

/**
 * Kind of change a candidate action makes to an account's holdings.
 * OPEN creates or adds to a position, CLOSE removes it entirely, RESIZE moves it to a target quantity.
 */
public enum ActionType {
    OPEN,
    CLOSE,
    RESIZE
}
