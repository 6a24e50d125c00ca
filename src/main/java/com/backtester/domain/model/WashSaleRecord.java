package com.backtester.domain.model;

import java.time.LocalDate;
import lombok.Value;

/** A loss that was disallowed because a replacement lot was acquired within the wash-sale window. */
@Value
public class WashSaleRecord {

    String symbol;
    LocalDate saleDate;
    String lotId;
    double disallowedLoss;
}
