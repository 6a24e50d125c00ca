package com.backtester.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Daily OHLCV bar. The simulation values positions at {@code adjClose}, which already
 * reflects splits.
 */
@Value
@Builder
public class Bar {

    LocalDate date;
    double open;
    double high;
    double low;
    double close;
    double adjClose;
    double volume;
}
