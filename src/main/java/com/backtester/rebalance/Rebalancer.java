package com.backtester.rebalance;

import com.backtester.calendar.AlignmentRule;
import com.backtester.calendar.TradingCalendar;
import com.backtester.domain.enums.AccountType;
import com.backtester.domain.enums.CalendarPeriod;
import com.backtester.domain.enums.RebalanceReason;
import com.backtester.domain.enums.RebalanceType;
import com.backtester.domain.model.Position;
import com.backtester.domain.model.TradeIntent;
import com.backtester.domain.model.strategy.DriftThresholds;
import com.backtester.domain.model.strategy.RebalancingConfig;
import com.backtester.portfolio.Portfolio;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides when to rebalance and plans the trades that bring the ledger back to its target
 * weights.
 *
 * <p>Two trigger channels are evaluated independently:
 * <ul>
 *   <li>Calendar: the first evaluation only schedules the next period boundary; later
 *       evaluations fire once the current date reaches it, then schedule the next one
 *       from the current date.</li>
 *   <li>Drift: fires when any target symbol's weight deviates beyond the absolute or
 *       relative threshold.</li>
 * </ul>
 *
 * <p>One instance per simulation run; it holds the scheduled calendar date.
 */
public class Rebalancer {

    private static final Logger log = LoggerFactory.getLogger(Rebalancer.class);

    /** Planned trades worth less than this many dollars are dropped. */
    public static final double MIN_TRADE_VALUE = 1.0;

    /** Simple-plan buys are scaled down by this factor to leave room for slippage. */
    static final double BUY_SLIPPAGE_BUFFER = 0.999;

    private final RebalancingConfig config;
    private final TradingCalendar calendar;
    private final AccountType accountType;

    private LocalDate nextCalendarRebalance;

    public Rebalancer(RebalancingConfig config, TradingCalendar calendar, AccountType accountType) {
        this.config = config;
        this.calendar = calendar;
        this.accountType = accountType;
    }

    public RebalanceDecision shouldRebalance(
            LocalDate currentDate,
            Map<String, Double> currentWeights,
            Map<String, Double> targetWeights,
            boolean isDepositDay) {
        RebalanceType type = config.getType();

        if (type == RebalanceType.CASHFLOW_ONLY) {
            return isDepositDay ? RebalanceDecision.because(RebalanceReason.DEPOSIT) : RebalanceDecision.none();
        }

        boolean calendarTrigger = false;
        if ((type == RebalanceType.CALENDAR || type == RebalanceType.BOTH) && config.getCalendarPeriod() != null) {
            calendarTrigger = checkCalendarTrigger(currentDate);
        }

        boolean driftTrigger = false;
        if ((type == RebalanceType.DRIFT || type == RebalanceType.BOTH) && config.getDrift() != null) {
            driftTrigger = checkDriftTrigger(currentWeights, targetWeights);
        }

        if (calendarTrigger) {
            log.debug("Calendar rebalance triggered on {}", currentDate);
            return RebalanceDecision.because(RebalanceReason.CALENDAR);
        }
        if (driftTrigger) {
            log.debug("Drift rebalance triggered on {}", currentDate);
            return RebalanceDecision.because(RebalanceReason.DRIFT);
        }
        if (isDepositDay) {
            return RebalanceDecision.because(RebalanceReason.DEPOSIT);
        }
        return RebalanceDecision.none();
    }

    /** Next scheduled calendar rebalance, or null before the first evaluation. */
    public LocalDate getNextCalendarRebalance() {
        return nextCalendarRebalance;
    }

    private boolean checkCalendarTrigger(LocalDate currentDate) {
        CalendarPeriod period = config.getCalendarPeriod();
        if (nextCalendarRebalance == null) {
            nextCalendarRebalance = nextCalendarDate(currentDate, period);
            return false;
        }
        if (!currentDate.isBefore(nextCalendarRebalance)) {
            nextCalendarRebalance = nextCalendarDate(currentDate, period);
            return true;
        }
        return false;
    }

    LocalDate nextCalendarDate(LocalDate currentDate, CalendarPeriod period) {
        return switch (period) {
            case WEEKLY -> calendar.alignToTradingDay(currentDate.plusDays(7), AlignmentRule.FIRST_BUSINESS_DAY);
            case MONTHLY -> {
                LocalDate nextMonth = currentDate.withDayOfMonth(1).plusMonths(1);
                yield calendar.firstTradingDayOfMonth(nextMonth.getYear(), nextMonth.getMonthValue());
            }
            case QUARTERLY -> {
                int quarter = (currentDate.getMonthValue() - 1) / 3 + 1;
                yield quarter == 4
                        ? calendar.firstTradingDayOfQuarter(currentDate.getYear() + 1, 1)
                        : calendar.firstTradingDayOfQuarter(currentDate.getYear(), quarter + 1);
            }
            case YEARLY -> calendar.firstTradingDayOfYear(currentDate.getYear() + 1);
            default -> calendar.nextTradingDay(currentDate);
        };
    }

    private boolean checkDriftTrigger(Map<String, Double> currentWeights, Map<String, Double> targetWeights) {
        DriftThresholds drift = config.getDrift();

        if (drift.getAbsPct() != null) {
            for (Map.Entry<String, Double> target : targetWeights.entrySet()) {
                double current = currentWeights.getOrDefault(target.getKey(), 0.0);
                if (Math.abs(current - target.getValue()) > drift.getAbsPct()) {
                    return true;
                }
            }
        }

        if (drift.getRelPct() != null) {
            for (Map.Entry<String, Double> target : targetWeights.entrySet()) {
                double current = currentWeights.getOrDefault(target.getKey(), 0.0);
                double weight = target.getValue();
                if (weight > 0 && Math.abs(current - weight) / weight > drift.getRelPct()) {
                    return true;
                }
            }
        }

        return false;
    }

    // ---- Trade planning ----

    /**
     * Splits a deposit across the target weights. Existing positions are left alone.
     * Symbols without a usable price are left out.
     */
    public List<TradeIntent> generateDepositTrades(
            Map<String, Double> targetWeights, double depositAmount, Map<String, Double> prices) {
        List<TradeIntent> intents = new ArrayList<>();
        if (depositAmount <= 0) {
            return intents;
        }
        for (Map.Entry<String, Double> target : targetWeights.entrySet()) {
            double weight = target.getValue();
            Double price = prices.get(target.getKey());
            if (weight <= 0 || price == null || price <= 0) {
                continue;
            }
            intents.add(TradeIntent.buy(target.getKey(), depositAmount * weight / price));
        }
        return intents;
    }

    /**
     * Plans the trades that move every target symbol to {@code weight * totalValue}.
     * Taxable accounts get tax-aware ordering: overweight loss positions are sold first
     * (largest loss first), then underweight symbols are bought, then overweight gain
     * positions are sold. Other accounts get one direct buy or sell per symbol.
     */
    public List<TradeIntent> generateRebalanceTrades(
            Portfolio portfolio, Map<String, Double> targetWeights, Map<String, Double> prices) {
        double totalValue = portfolio.getTotalValue(prices);
        if (totalValue <= 0) {
            return List.of();
        }

        Map<String, Position> positions = new HashMap<>();
        for (Position position : portfolio.getAllPositions(prices)) {
            positions.put(position.getSymbol(), position);
        }

        Map<String, Double> currentValues = new HashMap<>();
        Map<String, Double> targetValues = new LinkedHashMap<>();
        for (Map.Entry<String, Double> target : targetWeights.entrySet()) {
            String symbol = target.getKey();
            Position position = positions.get(symbol);
            currentValues.put(symbol, position != null ? position.getMarketValue() : 0.0);
            targetValues.put(symbol, target.getValue() * totalValue);
        }

        List<TradeIntent> intents = accountType.isTaxable()
                ? taxAwareTrades(portfolio, positions, currentValues, targetValues, prices)
                : simpleTrades(portfolio, currentValues, targetValues, prices);
        log.debug("Planned {} rebalance trades at total value {}", intents.size(), totalValue);
        return intents;
    }

    private List<TradeIntent> simpleTrades(
            Portfolio portfolio,
            Map<String, Double> currentValues,
            Map<String, Double> targetValues,
            Map<String, Double> prices) {
        List<TradeIntent> intents = new ArrayList<>();
        for (Map.Entry<String, Double> target : targetValues.entrySet()) {
            String symbol = target.getKey();
            Double price = prices.get(symbol);
            double diff = target.getValue() - currentValues.get(symbol);
            if (price == null || price <= 0 || Math.abs(diff) < MIN_TRADE_VALUE) {
                continue;
            }
            if (diff > 0) {
                intents.add(TradeIntent.buy(symbol, diff * BUY_SLIPPAGE_BUFFER / price));
            } else {
                intents.add(TradeIntent.sell(symbol, sellQuantity(portfolio, symbol, -diff, price)));
            }
        }
        return intents;
    }

    private List<TradeIntent> taxAwareTrades(
            Portfolio portfolio,
            Map<String, Position> positions,
            Map<String, Double> currentValues,
            Map<String, Double> targetValues,
            Map<String, Double> prices) {
        List<Position> lossPositions = new ArrayList<>();
        List<Position> gainPositions = new ArrayList<>();

        for (String symbol : targetValues.keySet()) {
            Position position = positions.get(symbol);
            if (position == null || currentValues.get(symbol) <= targetValues.get(symbol)) {
                continue;
            }
            if (position.getUnrealizedGain() < 0) {
                lossPositions.add(position);
            } else {
                gainPositions.add(position);
            }
        }
        lossPositions.sort(Comparator.comparingDouble(Position::getUnrealizedGain));

        List<TradeIntent> intents = new ArrayList<>();
        for (Position position : lossPositions) {
            addSell(intents, portfolio, position.getSymbol(), currentValues, targetValues, prices);
        }

        for (Map.Entry<String, Double> target : targetValues.entrySet()) {
            String symbol = target.getKey();
            Double price = prices.get(symbol);
            double buyValue = target.getValue() - currentValues.get(symbol);
            if (price != null && price > 0 && buyValue >= MIN_TRADE_VALUE) {
                intents.add(TradeIntent.buy(symbol, buyValue / price));
            }
        }

        for (Position position : gainPositions) {
            addSell(intents, portfolio, position.getSymbol(), currentValues, targetValues, prices);
        }
        return intents;
    }

    private void addSell(
            List<TradeIntent> intents,
            Portfolio portfolio,
            String symbol,
            Map<String, Double> currentValues,
            Map<String, Double> targetValues,
            Map<String, Double> prices) {
        Double price = prices.get(symbol);
        double sellValue = currentValues.get(symbol) - targetValues.get(symbol);
        if (price == null || price <= 0 || sellValue < MIN_TRADE_VALUE) {
            return;
        }
        intents.add(TradeIntent.sell(symbol, sellQuantity(portfolio, symbol, sellValue, price)));
    }

    private static double sellQuantity(Portfolio portfolio, String symbol, double sellValue, double price) {
        return Math.min(sellValue / price, portfolio.getTotalQuantity(symbol));
    }
}
