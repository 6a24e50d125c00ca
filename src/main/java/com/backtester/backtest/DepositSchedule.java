package com.backtester.backtest;

import com.backtester.calendar.TradingCalendar;
import com.backtester.domain.model.strategy.DepositConfig;
import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Decides which trading days receive a scheduled deposit.
 *
 * <ul>
 *   <li>DAILY, EVERY_MARKET_DAY: every trading day</li>
 *   <li>WEEKLY: Mondays (a Monday holiday skips that week)</li>
 *   <li>MONTHLY, QUARTERLY, YEARLY: first trading day of the period</li>
 * </ul>
 */
public class DepositSchedule {

    private final DepositConfig config;
    private final TradingCalendar calendar;

    public DepositSchedule(DepositConfig config, TradingCalendar calendar) {
        this.config = config;
        this.calendar = calendar;
    }

    public boolean isDepositDay(LocalDate date) {
        if (config == null || !config.isActive()) {
            return false;
        }
        return switch (config.getCadence()) {
            case DAILY, EVERY_MARKET_DAY -> true;
            case WEEKLY -> date.getDayOfWeek() == DayOfWeek.MONDAY;
            case MONTHLY -> date.equals(calendar.firstTradingDayOfMonth(date.getYear(), date.getMonthValue()));
            case QUARTERLY -> date.equals(calendar.firstTradingDayOfQuarter(date.getYear(), quarterOf(date)));
            case YEARLY -> date.equals(calendar.firstTradingDayOfYear(date.getYear()));
            default -> false;
        };
    }

    private static int quarterOf(LocalDate date) {
        return (date.getMonthValue() - 1) / 3 + 1;
    }

    public double getAmount() {
        return config != null ? config.getAmount() : 0.0;
    }
}
