package com.backtester.domain.enums;

/** Kind of event recorded in the ledger's trade log. */
public enum TradeAction {
    BUY,
    SELL,
    DRIP,
    DIVIDEND
}
