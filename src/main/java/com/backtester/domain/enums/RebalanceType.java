package com.backtester.domain.enums;

/**
 * Which trigger channels may start a full rebalance.
 *
 * <p>CASHFLOW_ONLY never rebalances on its own; it only invests deposits.
 */
public enum RebalanceType {
    CALENDAR,
    DRIFT,
    BOTH,
    CASHFLOW_ONLY
}
