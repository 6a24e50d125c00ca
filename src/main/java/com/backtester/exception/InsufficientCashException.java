package com.backtester.exception;

import java.util.Map;

/**
 * A buy costs more than the ledger's available cash. The runner avoids it by clamping the
 * quantity to what is affordable.
 */
public class InsufficientCashException extends BaseException {

    public InsufficientCashException(String symbol, double required, double available) {
        super(
                ErrorCode.INSUFFICIENT_CASH,
                String.format("Insufficient cash: need $%.2f, have $%.2f", required, available),
                Map.of("symbol", symbol, "required", required, "available", available));
    }
}
