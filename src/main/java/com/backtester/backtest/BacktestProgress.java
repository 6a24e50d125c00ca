package com.backtester.backtest;

import java.time.LocalDate;
import lombok.Value;

/** Cooperative progress checkpoint emitted by a running simulation. */
@Value
public class BacktestProgress {

    String strategyName;
    LocalDate date;
    int dayIndex;
    int totalDays;
    double portfolioValue;

    public double getPercentComplete() {
        return totalDays > 0 ? 100.0 * (dayIndex + 1) / totalDays : 100.0;
    }
}
