package com.backtester.domain.enums;

/**
 * When scheduled deposits land. Period cadences deposit on the first trading day of the
 * period; WEEKLY deposits on Mondays.
 */
public enum DepositCadence {
    NONE,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY,
    EVERY_MARKET_DAY
}
