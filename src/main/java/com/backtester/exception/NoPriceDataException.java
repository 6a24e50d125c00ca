package com.backtester.exception;

import java.time.LocalDate;
import java.util.Map;

public class NoPriceDataException extends BaseException {

    public NoPriceDataException(String symbol, LocalDate date) {
        super(
                ErrorCode.NO_PRICE_DATA,
                "No price data for " + symbol + " on " + date,
                Map.of("symbol", symbol, "date", date));
    }
}
