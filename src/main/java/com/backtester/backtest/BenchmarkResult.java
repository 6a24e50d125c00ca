package com.backtester.backtest;

import com.backtester.domain.model.EquityPoint;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Buy-and-hold simulation of one benchmark symbol under the strategy's cash flows. */
@Value
@Builder
public class BenchmarkResult {

    String symbol;
    List<EquityPoint> equityCurve;
    double finalValue;
    double totalDeposits;
}
