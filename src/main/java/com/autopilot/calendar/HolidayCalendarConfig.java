package com.autopilot.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange calendar loaded from the {@code market-calendar} prefix.
 *
 * <p>{@code covered-years} lists the years for which the holiday list is known to be complete.
 * {@link MarketSessionOracle} treats any instant outside those years as market-closed.
 */
@Component
@ConfigurationProperties(prefix = "market-calendar")
public class HolidayCalendarConfig {

    private String exchange = "NYSE";
    private String timezone = "America/New_York";
    private List<Integer> coveredYears = new ArrayList<>();
    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<Integer> getCoveredYears() {
        return coveredYears;
    }

    public void setCoveredYears(List<Integer> coveredYears) {
        this.coveredYears = coveredYears;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;

        public Holiday() {}

        public Holiday(LocalDate date, String name, HolidayType type) {
            this.date = date;
            this.name = name;
            this.type = type;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }
    }
}
