package com.autopilot.calendar;

import com.autopilot.domain.enums.MarketPhase;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers "is the regular session open" and "when is the next open/close" for US equities.
 *
 * <p>Pure function of the supplied instant. Any instant whose exchange-local year is not listed in
 * {@link HolidayCalendarConfig#getCoveredYears()} is reported as closed, as is any evaluation that
 * throws, so the scheduler falls back to backtesting instead of trading on a stale calendar.
 */
@Service
public class MarketSessionOracle {

    private static final Logger log = LoggerFactory.getLogger(MarketSessionOracle.class);

    static final LocalTime EARLY_CLOSE_TIME = LocalTime.of(13, 0);
    private static final int MAX_BOUNDARY_SEARCH_DAYS = 370;

    private final ZoneId zone;
    private final Set<Integer> coveredYears;
    private final Map<LocalDate, HolidayType> holidays;

    public MarketSessionOracle(HolidayCalendarConfig holidayCalendarConfig) {
        this.zone = ZoneId.of(holidayCalendarConfig.getTimezone());
        this.coveredYears = Set.copyOf(holidayCalendarConfig.getCoveredYears());
        this.holidays = holidayCalendarConfig.getHolidays().stream()
                .collect(Collectors.toUnmodifiableMap(
                        HolidayCalendarConfig.Holiday::getDate,
                        HolidayCalendarConfig.Holiday::getType,
                        (a, b) -> a == HolidayType.FULL_HOLIDAY ? a : b));
        log.info(
                "Market calendar {} loaded: zone={}, coveredYears={}, holidays={}",
                holidayCalendarConfig.getExchange(),
                zone,
                coveredYears,
                holidays.size());
    }

    public boolean isMarketOpen(Instant now) {
        try {
            return phaseAt(now) == MarketPhase.REGULAR;
        } catch (RuntimeException e) {
            log.warn("Market calendar evaluation failed for {}, assuming closed", now, e);
            return false;
        }
    }

    /**
     * Returns the next session boundary: today's close while the regular session is open, otherwise
     * the next regular open. Empty when the boundary lies beyond the covered calendar years.
     */
    public Optional<Instant> nextBoundary(Instant now) {
        try {
            ZonedDateTime local = now.atZone(zone);
            LocalDate date = local.toLocalDate();
            if (isMarketOpen(now)) {
                return Optional.of(date.atTime(closeTime(date)).atZone(zone).toInstant());
            }
            if (isTradingDay(date) && local.toLocalTime().isBefore(MarketPhase.REGULAR.getStartTime())) {
                return Optional.of(openInstant(date));
            }
            LocalDate next = date.plusDays(1);
            for (int i = 0; i < MAX_BOUNDARY_SEARCH_DAYS; i++) {
                if (!isCovered(next)) {
                    return Optional.empty();
                }
                if (isTradingDay(next)) {
                    return Optional.of(openInstant(next));
                }
                next = next.plusDays(1);
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Next boundary evaluation failed for {}", now, e);
            return Optional.empty();
        }
    }

    public MarketPhase phaseAt(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalDate date = local.toLocalDate();
        LocalTime time = local.toLocalTime();
        if (!isCovered(date) || !isTradingDay(date)) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.PRE_MARKET.getStartTime())) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.REGULAR.getStartTime())) {
            return MarketPhase.PRE_MARKET;
        }
        if (time.isBefore(closeTime(date))) {
            return MarketPhase.REGULAR;
        }
        if (time.isBefore(MarketPhase.AFTER_HOURS.getEndTime())) {
            return MarketPhase.AFTER_HOURS;
        }
        return MarketPhase.CLOSED;
    }

    /** Exchange-local trading date of the instant; sessions reset when this changes. */
    public LocalDate tradingDate(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return holidays.get(date) != HolidayType.FULL_HOLIDAY;
    }

    public boolean isEarlyClose(LocalDate date) {
        return holidays.get(date) == HolidayType.EARLY_CLOSE;
    }

    public boolean isCovered(LocalDate date) {
        return coveredYears.contains(date.getYear());
    }

    public ZoneId getZone() {
        return zone;
    }

    private LocalTime closeTime(LocalDate date) {
        return isEarlyClose(date) ? EARLY_CLOSE_TIME : MarketPhase.REGULAR.getEndTime();
    }

    private Instant openInstant(LocalDate date) {
        return date.atTime(MarketPhase.REGULAR.getStartTime()).atZone(zone).toInstant();
    }
}
