package com.backtester.domain.enums;

/**
 * DRIP: dividend cash immediately buys more shares of the paying symbol.
 * CASH: dividend stays in the cash balance until the next rebalance.
 */
public enum DividendMode {
    DRIP,
    CASH
}
