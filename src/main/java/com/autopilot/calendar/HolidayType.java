package com.autopilot.calendar;

/** Kind of exception to the regular weekday session. */
public enum HolidayType {

    /** Exchange closed all day. */
    FULL_HOLIDAY,

    /** Session closes at 13:00 exchange time. */
    EARLY_CLOSE
}
