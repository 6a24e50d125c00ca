package com.backtester.domain.model;

import com.backtester.domain.enums.OrderSide;
import lombok.Value;

/** A planned (not yet executed) trade emitted by the rebalancer. */
@Value
public class TradeIntent {

    String symbol;
    OrderSide side;
    double quantity;

    public static TradeIntent buy(String symbol, double quantity) {
        return new TradeIntent(symbol, OrderSide.BUY, quantity);
    }

    public static TradeIntent sell(String symbol, double quantity) {
        return new TradeIntent(symbol, OrderSide.SELL, quantity);
    }
}
