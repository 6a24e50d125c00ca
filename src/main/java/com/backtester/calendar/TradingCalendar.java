package com.backtester.calendar;

import java.time.LocalDate;
import java.util.List;

/**
 * Trading-day oracle consumed by the simulation. Answers which dates the exchange is open
 * and aligns arbitrary dates to trading days and period boundaries.
 */
public interface TradingCalendar {

    /** Ordered trading days between start and end, both inclusive. */
    List<LocalDate> tradingDays(LocalDate start, LocalDate end);

    boolean isTradingDay(LocalDate date);

    /** First trading day strictly after the given date. */
    LocalDate nextTradingDay(LocalDate date);

    /** Last trading day strictly before the given date. */
    LocalDate previousTradingDay(LocalDate date);

    default LocalDate firstTradingDayOfMonth(int year, int month) {
        return alignToTradingDay(LocalDate.of(year, month, 1), AlignmentRule.FIRST_BUSINESS_DAY);
    }

    default LocalDate lastTradingDayOfMonth(int year, int month) {
        LocalDate lastDay = LocalDate.of(year, month, 1).plusMonths(1).minusDays(1);
        return alignToTradingDay(lastDay, AlignmentRule.LAST_BUSINESS_DAY);
    }

    /** Quarter is 1-based (1..4). */
    default LocalDate firstTradingDayOfQuarter(int year, int quarter) {
        return firstTradingDayOfMonth(year, (quarter - 1) * 3 + 1);
    }

    default LocalDate firstTradingDayOfYear(int year) {
        return firstTradingDayOfMonth(year, 1);
    }

    default LocalDate alignToTradingDay(LocalDate date, AlignmentRule rule) {
        return switch (rule) {
            case NEXT -> nextTradingDay(date);
            case PREVIOUS -> previousTradingDay(date);
            case LAST_BUSINESS_DAY -> isTradingDay(date) ? date : previousTradingDay(date);
            default -> isTradingDay(date) ? date : nextTradingDay(date);
        };
    }
}
