package com.backtester.backtest;

import com.backtester.domain.model.EquityPoint;
import com.backtester.marketdata.SymbolMarketData;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Buy-and-hold reference portfolio: starts with the strategy's initial cash, receives the
 * same scheduled deposits (without caps) and invests all cash in one symbol every day.
 * No frictions, dividends or taxes.
 */
@Component
public class BenchmarkSimulator {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkSimulator.class);

    public BenchmarkResult simulate(
            String symbol,
            SymbolMarketData data,
            List<LocalDate> tradingDays,
            double initialCash,
            DepositSchedule depositSchedule) {
        double shares = 0.0;
        double cash = initialCash;
        double totalDeposits = 0.0;
        List<EquityPoint> equityCurve = new ArrayList<>();

        for (LocalDate date : tradingDays) {
            Double price = data.priceOn(date);
            if (price == null || price <= 0) {
                continue;
            }
            if (depositSchedule.isDepositDay(date)) {
                cash += depositSchedule.getAmount();
                totalDeposits += depositSchedule.getAmount();
            }
            if (cash > 0) {
                shares += cash / price;
                cash = 0.0;
            }
            double value = shares * price + cash;
            equityCurve.add(EquityPoint.builder()
                    .date(date)
                    .totalValue(value)
                    .cash(cash)
                    .positionsValue(value - cash)
                    .build());
        }

        double finalValue = equityCurve.isEmpty() ? initialCash : equityCurve.get(equityCurve.size() - 1).getTotalValue();
        log.debug("Benchmark {} simulated over {} days, final value {}", symbol, equityCurve.size(), finalValue);
        return BenchmarkResult.builder()
                .symbol(symbol)
                .equityCurve(equityCurve)
                .finalValue(finalValue)
                .totalDeposits(totalDeposits)
                .build();
    }
}
