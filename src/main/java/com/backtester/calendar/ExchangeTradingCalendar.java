package com.backtester.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Exchange calendar backed by {@link HolidayCalendarConfig}: weekdays trade unless listed
 * as a FULL_HOLIDAY. EARLY_CLOSE sessions count as trading days.
 *
 * <p>Trading days are cached one calendar year at a time and ranges are sliced from those
 * years, so the cache holds at most one entry per year ever queried. It is concurrent
 * because a strategy and its benchmarks may be simulated on separate threads against the
 * same bean.
 */
@Service
public class ExchangeTradingCalendar implements TradingCalendar {

    private static final Logger log = LoggerFactory.getLogger(ExchangeTradingCalendar.class);

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final Map<Integer, List<LocalDate>> yearCache = new ConcurrentHashMap<>();

    public ExchangeTradingCalendar(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidayCalendarConfig = holidayCalendarConfig;
    }

    @Override
    public List<LocalDate> tradingDays(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            return List.of();
        }
        List<LocalDate> days = new ArrayList<>();
        for (int year = start.getYear(); year <= end.getYear(); year++) {
            for (LocalDate d : tradingDaysOfYear(year)) {
                if (!d.isBefore(start) && !d.isAfter(end)) {
                    days.add(d);
                }
            }
        }
        return days;
    }

    /** Years whose trading days are currently cached. */
    public Set<Integer> getCachedYears() {
        return Set.copyOf(yearCache.keySet());
    }

    private List<LocalDate> tradingDaysOfYear(int year) {
        return yearCache.computeIfAbsent(year, key -> {
            List<LocalDate> days = new ArrayList<>();
            for (LocalDate d = LocalDate.of(year, 1, 1); d.getYear() == year; d = d.plusDays(1)) {
                if (isTradingDay(d)) {
                    days.add(d);
                }
            }
            log.debug("{} trading days in {} on {}", days.size(), year, holidayCalendarConfig.getExchange());
            return List.copyOf(days);
        });
    }

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     * Weekends (Saturday/Sunday) are always holidays.
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.datesOf(HolidayType.FULL_HOLIDAY).contains(date);
    }

    /** Returns true if the date has a shortened session. */
    public boolean isEarlyClose(LocalDate date) {
        return holidayCalendarConfig.datesOf(HolidayType.EARLY_CLOSE).contains(date);
    }

    @Override
    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    @Override
    public LocalDate nextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    @Override
    public LocalDate previousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }
}
