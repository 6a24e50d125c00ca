package com.backtester.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** End-of-day valuation snapshot. {@code positionsValue = totalValue - cash}. */
@Value
@Builder
public class EquityPoint {

    LocalDate date;
    double totalValue;
    double cash;
    double positionsValue;
}
