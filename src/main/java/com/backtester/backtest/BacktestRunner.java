package com.backtester.backtest;

import com.backtester.calendar.TradingCalendar;
import com.backtester.config.EngineProperties;
import com.backtester.domain.enums.DividendMode;
import com.backtester.domain.enums.TradeAction;
import com.backtester.domain.model.DividendEvent;
import com.backtester.domain.model.EquityPoint;
import com.backtester.domain.model.PositionSnapshot;
import com.backtester.domain.model.TradeIntent;
import com.backtester.domain.model.strategy.StrategyConfig;
import com.backtester.domain.model.strategy.TaxConfig;
import com.backtester.exception.ContributionCapExceededException;
import com.backtester.marketdata.SymbolMarketData;
import com.backtester.portfolio.Portfolio;
import com.backtester.rebalance.RebalanceDecision;
import com.backtester.rebalance.Rebalancer;
import com.backtester.tax.TaxCalculator;
import com.backtester.tax.TaxSummary;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Day-by-day simulation of one strategy against pre-loaded market data.
 *
 * <p>Each trading day runs a fixed pipeline:
 * <ol>
 *   <li>Resolve the day's prices; a day where no symbol has a price is skipped</li>
 *   <li>Credit dividends going ex today, reinvesting them under DRIP</li>
 *   <li>Add the scheduled deposit unless it would breach the annual contribution cap</li>
 *   <li>Apply expense-ratio drag to lot cost basis</li>
 *   <li>Invest the deposit at target weights, or fully rebalance when the trigger fires
 *       (always on the first day with prices)</li>
 *   <li>Snapshot the equity curve</li>
 *   <li>On the last trading day of a year (or of the run), accrue that year's tax</li>
 * </ol>
 *
 * <p>All run state is local to {@link #run}, so independent runs may execute concurrently
 * on the same instance.
 */
@Component
public class BacktestRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private static final int TRADING_DAYS_PER_YEAR = 252;

    private final TradingCalendar tradingCalendar;
    private final EngineProperties engineProperties;

    public BacktestRunner(TradingCalendar tradingCalendar, EngineProperties engineProperties) {
        this.tradingCalendar = tradingCalendar;
        this.engineProperties = engineProperties;
    }

    public BacktestResult run(StrategyConfig config, Map<String, SymbolMarketData> marketData, WarningLog warnings) {
        return run(config, marketData, warnings, BacktestProgressListener.NOOP);
    }

    public BacktestResult run(
            StrategyConfig config,
            Map<String, SymbolMarketData> marketData,
            WarningLog warnings,
            BacktestProgressListener listener) {
        TaxConfig taxConfig = config.getAccount().getTax();
        Portfolio portfolio = new Portfolio(
                config.getInitialCash(),
                config.getAccount().getType(),
                config.getLotMethod(),
                taxConfig.isApplyWashSale());
        Rebalancer rebalancer =
                new Rebalancer(config.getRebalancing(), tradingCalendar, config.getAccount().getType());
        TaxCalculator taxCalculator = new TaxCalculator(taxConfig);
        TradeExecutor tradeExecutor = new TradeExecutor(config.getFrictions());
        DepositSchedule depositSchedule = new DepositSchedule(config.getDeposits(), tradingCalendar);
        ContributionCapPolicy capPolicy = new ContributionCapPolicy(config.getAccount());

        List<LocalDate> tradingDays = tradingCalendar.tradingDays(config.getStartDate(), config.getEndDate());
        Map<String, Double> targetWeights = TargetWeights.calculate(config.getSymbols(), config.getPositionSizing());

        log.info(
                "Running '{}': {} symbols, {} trading days, {} account, initial cash {}",
                config.getName(),
                config.getSymbols().size(),
                tradingDays.size(),
                config.getAccount().getType(),
                config.getInitialCash());

        List<EquityPoint> equityCurve = new ArrayList<>();
        List<PositionSnapshot> positionsHistory = new ArrayList<>();
        Map<Integer, Double> yearEndValues = new TreeMap<>();
        Map<String, Double> markPrices = new HashMap<>();
        boolean firstPricedDay = true;
        int progressInterval = Math.max(1, engineProperties.getProgressIntervalDays());

        for (int i = 0; i < tradingDays.size(); i++) {
            LocalDate date = tradingDays.get(i);
            Map<String, Double> prices = pricesOn(marketData, date);

            if (!prices.isEmpty()) {
                markPrices.putAll(prices);

                processDividends(portfolio, marketData, prices, date, config, warnings);

                double deposited = processDeposit(portfolio, depositSchedule, capPolicy, date, warnings);

                applyExpenseDrag(portfolio, marketData);

                List<TradeIntent> intents;
                if (deposited > 0) {
                    // Only the new money is invested; existing positions stay put
                    intents = rebalancer.generateDepositTrades(targetWeights, deposited, markPrices);
                } else {
                    RebalanceDecision decision = rebalancer.shouldRebalance(
                            date, portfolio.getCurrentWeights(markPrices), targetWeights, false);
                    if (decision.isRebalance() || firstPricedDay) {
                        log.debug(
                                "Rebalancing on {} ({})",
                                date,
                                firstPricedDay ? "initial" : decision.getReason());
                        intents = rebalancer.generateRebalanceTrades(portfolio, targetWeights, markPrices);
                    } else {
                        intents = List.of();
                    }
                }
                tradeExecutor.execute(portfolio, intents, prices, date, warnings);
                firstPricedDay = false;

                double totalValue = portfolio.getTotalValue(markPrices);
                equityCurve.add(EquityPoint.builder()
                        .date(date)
                        .totalValue(totalValue)
                        .cash(portfolio.getCash())
                        .positionsValue(totalValue - portfolio.getCash())
                        .build());
                if (engineProperties.isRecordPositionsHistory()) {
                    positionsHistory.add(new PositionSnapshot(date, portfolio.getAllPositions(markPrices)));
                }
                yearEndValues.put(date.getYear(), totalValue);
            } else {
                log.debug("No prices on {}, skipping day", date);
            }

            if (isYearEnd(tradingDays, i)) {
                applyYearEndTax(portfolio, taxCalculator, taxConfig, date.getYear(), warnings);
            }

            if (i % progressInterval == 0 || i == tradingDays.size() - 1) {
                listener.onProgress(new BacktestProgress(
                        config.getName(), date, i, tradingDays.size(), portfolio.getTotalValue(markPrices)));
            }
        }

        return buildResult(
                config, portfolio, taxCalculator, equityCurve, positionsHistory, yearEndValues, markPrices,
                tradingDays.size(), warnings);
    }

    private Map<String, Double> pricesOn(Map<String, SymbolMarketData> marketData, LocalDate date) {
        Map<String, Double> prices = new LinkedHashMap<>();
        for (SymbolMarketData data : marketData.values()) {
            Double price = data.priceOn(date);
            if (price != null && price > 0) {
                prices.put(data.getSymbol(), price);
            }
        }
        return prices;
    }

    private void processDividends(
            Portfolio portfolio,
            Map<String, SymbolMarketData> marketData,
            Map<String, Double> prices,
            LocalDate date,
            StrategyConfig config,
            WarningLog warnings) {
        for (SymbolMarketData data : marketData.values()) {
            String symbol = data.getSymbol();
            for (DividendEvent dividend : data.dividendsOn(date)) {
                double held = portfolio.getTotalQuantity(symbol);
                if (held <= 0) {
                    continue;
                }
                double amount = held * dividend.getAmount();
                double qualifiedPct = dividend.getQualifiedPct() != null
                        ? dividend.getQualifiedPct()
                        : config.getAccount().getTax().getQualifiedDividendPct();
                portfolio.recordDividend(symbol, amount, date, qualifiedPct);

                if (config.getDividends().getMode() == DividendMode.DRIP) {
                    reinvestDividend(portfolio, symbol, amount, prices.get(symbol), date, warnings);
                }
            }
        }
    }

    private void reinvestDividend(
            Portfolio portfolio, String symbol, double amount, Double price, LocalDate date, WarningLog warnings) {
        if (price == null || price <= 0) {
            warnings.add("No price for " + symbol + " on " + date + ", dividend of "
                    + String.format("$%.2f", amount) + " kept as cash");
            return;
        }
        try {
            portfolio.buy(symbol, amount / price, price, date, 0.0, 0.0, TradeAction.DRIP);
        } catch (RuntimeException e) {
            warnings.add("DRIP failed on " + date + " for " + symbol + ", dividend kept as cash - " + e.getMessage());
        }
    }

    private double processDeposit(
            Portfolio portfolio,
            DepositSchedule depositSchedule,
            ContributionCapPolicy capPolicy,
            LocalDate date,
            WarningLog warnings) {
        if (!depositSchedule.isDepositDay(date)) {
            return 0.0;
        }
        double amount = depositSchedule.getAmount();
        try {
            capPolicy.checkDeposit(portfolio, date, amount);
        } catch (ContributionCapExceededException e) {
            warnings.add(e.getMessage());
            return 0.0;
        }
        portfolio.addDeposit(amount, date);
        return amount;
    }

    private void applyExpenseDrag(Portfolio portfolio, Map<String, SymbolMarketData> marketData) {
        for (SymbolMarketData data : marketData.values()) {
            double expenseRatio = data.getExpenseRatio();
            if (expenseRatio > 0) {
                double dailyRate = Math.pow(1 + expenseRatio, 1.0 / TRADING_DAYS_PER_YEAR) - 1;
                portfolio.applyCostBasisDrag(data.getSymbol(), dailyRate);
            }
        }
    }

    private void applyYearEndTax(
            Portfolio portfolio, TaxCalculator taxCalculator, TaxConfig taxConfig, int year, WarningLog warnings) {
        TaxSummary summary = taxCalculator.applyYearEndTax(year, portfolio, taxConfig.isPayTaxesFromExternal());
        if (summary.getTotalTax() > 0 && portfolio.getCash() < 0) {
            warnings.add(String.format(
                    "Cash balance negative after %d tax payment of $%.2f: $%.2f",
                    year, summary.getTotalTax(), portfolio.getCash()));
        }
    }

    static boolean isYearEnd(List<LocalDate> tradingDays, int index) {
        if (index >= tradingDays.size() - 1) {
            return true;
        }
        return tradingDays.get(index + 1).getYear() > tradingDays.get(index).getYear();
    }

    private BacktestResult buildResult(
            StrategyConfig config,
            Portfolio portfolio,
            TaxCalculator taxCalculator,
            List<EquityPoint> equityCurve,
            List<PositionSnapshot> positionsHistory,
            Map<Integer, Double> yearEndValues,
            Map<String, Double> markPrices,
            int tradingDayCount,
            WarningLog warnings) {
        List<TaxSummary> taxSummaries = new ArrayList<>();
        Map<Integer, Double> taxDrag = new LinkedHashMap<>();
        for (Map.Entry<Integer, Double> yearEnd : yearEndValues.entrySet()) {
            TaxSummary summary = taxCalculator.calculateAnnualTax(yearEnd.getKey(), portfolio);
            taxSummaries.add(summary);
            taxDrag.put(yearEnd.getKey(), TaxCalculator.calculateTaxDrag(summary, yearEnd.getValue()));
        }

        double finalValue = equityCurve.isEmpty()
                ? portfolio.getTotalValue(markPrices)
                : equityCurve.get(equityCurve.size() - 1).getTotalValue();
        double afterTaxValue = taxCalculator.calculateAfterTaxValue(portfolio, markPrices);

        log.info(
                "Backtest '{}' complete: final value {}, after-tax {}, {} trades, {} warnings",
                config.getName(),
                finalValue,
                afterTaxValue,
                portfolio.getTrades().size(),
                warnings.size());

        return BacktestResult.builder()
                .config(config)
                .equityCurve(equityCurve)
                .trades(List.copyOf(portfolio.getTrades()))
                .lots(portfolio.getAllLots())
                .positionsHistory(positionsHistory)
                .taxSummaries(taxSummaries)
                .taxDrag(taxDrag)
                .washSales(List.copyOf(portfolio.getWashSales()))
                .benchmarks(Map.of())
                .finalValue(finalValue)
                .afterTaxFinalValue(afterTaxValue)
                .finalCash(portfolio.getCash())
                .totalDeposits(portfolio.getTotalDeposits())
                .totalTaxesPaid(portfolio.getTotalTaxesPaid())
                .warnings(warnings.asList())
                .diagnostics(new BacktestResult.Diagnostics(
                        portfolio.getTrades().size(), config.getSymbols().size(), tradingDayCount, equityCurve.size()))
                .build();
    }
}
