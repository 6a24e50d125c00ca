package com.backtester.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Valued view of all lots held in one symbol. */
@Value
@Builder
public class Position {

    String symbol;
    double quantity;
    double marketValue;
    double costBasis;
    double unrealizedGain;
    List<Lot> lots;
}
