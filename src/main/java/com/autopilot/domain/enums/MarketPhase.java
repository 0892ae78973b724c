package com.autopilot.domain.enums;

import java.time.LocalTime;

/**
 * US equity session phases (exchange local time).
 *
 * <pre>
 * 04:00-09:30  PRE_MARKET
 * 09:30-16:00  REGULAR      (13:00 close on early-close days)
 * 16:00-20:00  AFTER_HOURS
 * 20:00-04:00  CLOSED
 * </pre>
 *
 * <p>Only REGULAR counts as "market open" for the scheduler.
 */
public enum MarketPhase {
    PRE_MARKET(LocalTime.of(4, 0), LocalTime.of(9, 30)),
    REGULAR(LocalTime.of(9, 30), LocalTime.of(16, 0)),
    AFTER_HOURS(LocalTime.of(16, 0), LocalTime.of(20, 0)),
    CLOSED(LocalTime.of(20, 0), LocalTime.of(4, 0));

    private final LocalTime startTime;
    private final LocalTime endTime;

    MarketPhase(LocalTime startTime, LocalTime endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }
}
