package com.backtester.domain.enums;

/** Buy or sell side of a planned trade intent. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
