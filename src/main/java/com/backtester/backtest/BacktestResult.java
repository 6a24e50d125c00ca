package com.backtester.backtest;

import com.backtester.domain.model.EquityPoint;
import com.backtester.domain.model.Lot;
import com.backtester.domain.model.PositionSnapshot;
import com.backtester.domain.model.Trade;
import com.backtester.domain.model.WashSaleRecord;
import com.backtester.domain.model.strategy.StrategyConfig;
import com.backtester.tax.TaxSummary;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a completed run produces. Sequences are ordered by date (or year); a degraded
 * run still returns a result, with the reasons listed in {@code warnings}.
 */
@Value
@Builder(toBuilder = true)
public class BacktestResult {

    StrategyConfig config;
    List<EquityPoint> equityCurve;
    List<Trade> trades;
    List<Lot> lots;
    List<PositionSnapshot> positionsHistory;
    List<TaxSummary> taxSummaries;

    /** Year to total tax divided by that year's closing portfolio value. */
    Map<Integer, Double> taxDrag;

    List<WashSaleRecord> washSales;
    Map<String, BenchmarkResult> benchmarks;

    double finalValue;
    double afterTaxFinalValue;
    double finalCash;
    double totalDeposits;
    double totalTaxesPaid;

    List<String> warnings;
    Diagnostics diagnostics;

    @Value
    public static class Diagnostics {
        int totalTrades;
        int totalSymbols;
        int tradingDays;
        int simulatedDays;
    }
}
