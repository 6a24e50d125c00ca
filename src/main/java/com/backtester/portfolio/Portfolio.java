package com.backtester.portfolio;

import com.backtester.domain.enums.AccountType;
import com.backtester.domain.enums.LotMethod;
import com.backtester.domain.enums.TradeAction;
import com.backtester.domain.model.Lot;
import com.backtester.domain.model.Position;
import com.backtester.domain.model.Trade;
import com.backtester.domain.model.WashSaleRecord;
import com.backtester.exception.InsufficientCashException;
import com.backtester.exception.InsufficientSharesException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tax-lot ledger for one simulated account.
 *
 * <p>Owns the cash balance, every open lot (grouped by symbol, in acquisition order), the
 * append-only trade log, wash-sale records and the per-year tax accumulators. It is
 * mutated only through {@link #buy}, {@link #sell}, {@link #recordDividend},
 * {@link #recordInterest}, {@link #addDeposit}, {@link #deductTax} and
 * {@link #applyCostBasisDrag}; every query hands out copies.
 *
 * <p>Realized gains and dividend income accrue only for TAXABLE accounts. Tax-deferred
 * accounts still track contributions (for cap checks and cash-flow reconstruction).
 *
 * <p>Not thread-safe. A ledger is owned by exactly one simulation run.
 */
public class Portfolio {

    private static final Logger log = LoggerFactory.getLogger(Portfolio.class);

    /** Lots at or below this many shares are considered depleted and removed. */
    public static final double LOT_DEPLETION_TOLERANCE = 1e-4;

    /** Holding periods of up to 365 days are short-term. */
    public static final int SHORT_TERM_DAYS = 365;

    /** Replacement purchases within this many days either side of a loss sale make it a wash sale. */
    public static final int WASH_SALE_DAYS = 30;

    // Absorbs floating-point residue when a planner asks for exactly the held quantity
    private static final double QUANTITY_EPSILON = 1e-9;

    private final double initialCash;
    private final AccountType accountType;
    private final LotMethod lotMethod;
    private final boolean applyWashSale;
    private final LotSelector lotSelector;

    private double cash;
    private double totalDeposits;
    private double totalTaxesPaid;

    private final Map<String, List<Lot>> lots = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final List<WashSaleRecord> washSales = new ArrayList<>();
    private final SortedMap<Integer, AnnualTaxAccumulator> annual = new TreeMap<>();

    public Portfolio(double initialCash, AccountType accountType, LotMethod lotMethod, boolean applyWashSale) {
        this(initialCash, accountType, lotMethod, applyWashSale, new LotSelector());
    }

    public Portfolio(
            double initialCash,
            AccountType accountType,
            LotMethod lotMethod,
            boolean applyWashSale,
            LotSelector lotSelector) {
        this.initialCash = initialCash;
        this.cash = initialCash;
        this.accountType = accountType;
        this.lotMethod = lotMethod;
        this.applyWashSale = applyWashSale;
        this.lotSelector = lotSelector;
    }

    // ---- Mutations ----

    /**
     * Buys shares and opens a new lot whose cost basis includes commission and slippage.
     *
     * @param action BUY or DRIP
     * @throws InsufficientCashException if the total cost exceeds available cash
     */
    public Trade buy(
            String symbol,
            double quantity,
            double price,
            LocalDate date,
            double commission,
            double slippage,
            TradeAction action) {
        if (quantity <= 0 || price <= 0) {
            throw new IllegalArgumentException(
                    "Buy requires positive quantity and price, got " + quantity + " @ " + price + " for " + symbol);
        }
        double totalCost = quantity * price + commission + slippage;
        if (cash < totalCost) {
            throw new InsufficientCashException(symbol, totalCost, cash);
        }

        cash -= totalCost;

        Lot lot = Lot.builder()
                .lotId(UUID.randomUUID().toString())
                .symbol(symbol)
                .quantity(quantity)
                .costBasis(totalCost)
                .acquisitionDate(date)
                .build();
        lots.computeIfAbsent(symbol, s -> new ArrayList<>()).add(lot);

        Trade trade = Trade.builder()
                .tradeId(UUID.randomUUID().toString())
                .date(date)
                .symbol(symbol)
                .action(action)
                .quantity(quantity)
                .price(price)
                .commission(commission)
                .slippage(slippage)
                .netCashImpact(-totalCost)
                .lotId(lot.getLotId())
                .build();
        trades.add(trade);

        log.debug("{} {} {} @ {} cost={} cash={}", action, quantity, symbol, price, totalCost, cash);
        return trade;
    }

    public Trade buy(String symbol, double quantity, double price, LocalDate date, double commission, double slippage) {
        return buy(symbol, quantity, price, date, commission, slippage, TradeAction.BUY);
    }

    /**
     * Sells shares, relieving lots in the order given by the lot method.
     *
     * <p>Net proceeds are apportioned to each relieved lot by quantity. For taxable accounts
     * each portion's gain accrues as short- or long-term; a loss is disallowed (set to zero)
     * when wash-sale enforcement is on and another held lot of the symbol was acquired within
     * {@value #WASH_SALE_DAYS} days of the sale, excluding same-day acquisitions. Only lots
     * that exist at sale time are inspected: a later purchase does not reclassify the loss.
     *
     * @throws InsufficientSharesException if fewer shares are held than requested
     */
    public Trade sell(String symbol, double quantity, double price, LocalDate date, double commission, double slippage) {
        double held = getTotalQuantity(symbol);
        if (quantity <= 0 || held + QUANTITY_EPSILON < quantity) {
            throw new InsufficientSharesException(symbol, quantity, held);
        }

        List<Lot> symbolLots = lots.get(symbol);
        List<LotSelector.LotAllocation> allocations =
                lotSelector.select(symbolLots, quantity, lotMethod, accountType);

        double netProceeds = quantity * price - commission - slippage;
        cash += netProceeds;

        Trade.TradeBuilder trade = Trade.builder()
                .tradeId(UUID.randomUUID().toString())
                .date(date)
                .symbol(symbol)
                .action(TradeAction.SELL)
                .quantity(quantity)
                .price(price)
                .commission(commission)
                .slippage(slippage)
                .netCashImpact(netProceeds);

        for (LotSelector.LotAllocation allocation : allocations) {
            Lot lot = allocation.getLot();
            double fromLot = allocation.getQuantity();
            trade.lotId(lot.getLotId());

            double costPortion = lot.getCostBasis() * (fromLot / lot.getQuantity());
            double proceedsPortion = (fromLot / quantity) * netProceeds;
            double gain = proceedsPortion - costPortion;

            long holdingDays = ChronoUnit.DAYS.between(lot.getAcquisitionDate(), date);
            boolean shortTerm = holdingDays <= SHORT_TERM_DAYS;

            if (accountType.isTaxable()
                    && applyWashSale
                    && gain < 0
                    && hasReplacementPurchase(symbol, date)) {
                double disallowed = Math.abs(gain);
                lot.setWashSale(true);
                lot.setWashSaleDisallowed(lot.getWashSaleDisallowed() + disallowed);
                washSales.add(new WashSaleRecord(symbol, date, lot.getLotId(), disallowed));
                log.debug("Wash sale on {} {}: disallowed loss {}", date, symbol, disallowed);
                gain = 0.0;
            }

            if (accountType.isTaxable()) {
                AnnualTaxAccumulator year = accumulatorFor(date.getYear());
                if (shortTerm) {
                    year.setRealizedShortTerm(year.getRealizedShortTerm() + gain);
                } else {
                    year.setRealizedLongTerm(year.getRealizedLongTerm() + gain);
                }
            }

            lot.setQuantity(lot.getQuantity() - fromLot);
            lot.setCostBasis(lot.getCostBasis() - costPortion);
            if (lot.getQuantity() <= LOT_DEPLETION_TOLERANCE) {
                symbolLots.remove(lot);
            }
        }

        if (symbolLots.isEmpty()) {
            lots.remove(symbol);
        }

        Trade executed = trade.build();
        trades.add(executed);
        log.debug("SELL {} {} @ {} proceeds={} cash={}", quantity, symbol, price, netProceeds, cash);
        return executed;
    }

    /**
     * Credits a cash dividend and appends a DIVIDEND entry to the trade log. For taxable
     * accounts the amount is split into qualified and ordinary income by {@code qualifiedPct}.
     *
     * @param amount total dividend for the whole position
     */
    public Trade recordDividend(String symbol, double amount, LocalDate exDate, double qualifiedPct) {
        cash += amount;

        if (accountType.isTaxable()) {
            AnnualTaxAccumulator year = accumulatorFor(exDate.getYear());
            year.setQualifiedDividends(year.getQualifiedDividends() + amount * qualifiedPct);
            year.setOrdinaryDividends(year.getOrdinaryDividends() + amount * (1 - qualifiedPct));
        }

        double held = getTotalQuantity(symbol);
        Trade trade = Trade.builder()
                .tradeId(UUID.randomUUID().toString())
                .date(exDate)
                .symbol(symbol)
                .action(TradeAction.DIVIDEND)
                .quantity(held)
                .price(held > 0 ? amount / held : 0.0)
                .netCashImpact(amount)
                .notes(String.format("Dividend: $%.2f on %.4f shares", amount, held))
                .build();
        trades.add(trade);
        return trade;
    }

    /** Credits interest income (e.g. cash sweep); taxed as ordinary income in taxable accounts. */
    public void recordInterest(double amount, LocalDate date) {
        cash += amount;
        if (accountType.isTaxable()) {
            AnnualTaxAccumulator year = accumulatorFor(date.getYear());
            year.setInterest(year.getInterest() + amount);
        }
    }

    public void addDeposit(double amount, LocalDate date) {
        cash += amount;
        totalDeposits += amount;
        AnnualTaxAccumulator year = accumulatorFor(date.getYear());
        year.setContributions(year.getContributions() + amount);
    }

    /**
     * Debits a tax payment. The balance may go negative when cash does not cover the bill;
     * callers decide how to report that.
     */
    public void deductTax(double amount) {
        cash -= amount;
        totalTaxesPaid += amount;
    }

    /** Debits a tax payment and books it against the given tax year. */
    public void deductTax(double amount, int taxYear) {
        deductTax(amount);
        AnnualTaxAccumulator year = accumulatorFor(taxYear);
        year.setTaxesPaid(year.getTaxesPaid() + amount);
    }

    /**
     * Erodes the cost basis of every lot of a symbol by {@code dailyRate}. Models fund
     * expense drag on basis rather than cash.
     */
    public void applyCostBasisDrag(String symbol, double dailyRate) {
        List<Lot> symbolLots = lots.get(symbol);
        if (symbolLots == null || dailyRate <= 0) {
            return;
        }
        for (Lot lot : symbolLots) {
            lot.setCostBasis(lot.getCostBasis() * (1 - dailyRate));
        }
    }

    // ---- Queries ----

    public double getCash() {
        return cash;
    }

    public double getInitialCash() {
        return initialCash;
    }

    public double getTotalDeposits() {
        return totalDeposits;
    }

    public double getTotalTaxesPaid() {
        return totalTaxesPaid;
    }

    public AccountType getAccountType() {
        return accountType;
    }

    public LotMethod getLotMethod() {
        return lotMethod;
    }

    public boolean isApplyWashSale() {
        return applyWashSale;
    }

    public double getTotalQuantity(String symbol) {
        List<Lot> symbolLots = lots.get(symbol);
        if (symbolLots == null) {
            return 0.0;
        }
        return symbolLots.stream().mapToDouble(Lot::getQuantity).sum();
    }

    public double getCostBasis(String symbol) {
        List<Lot> symbolLots = lots.get(symbol);
        if (symbolLots == null) {
            return 0.0;
        }
        return symbolLots.stream().mapToDouble(Lot::getCostBasis).sum();
    }

    /** Copies of the lots held in a symbol, in acquisition order. */
    public List<Lot> getLots(String symbol) {
        List<Lot> symbolLots = lots.get(symbol);
        if (symbolLots == null) {
            return List.of();
        }
        return symbolLots.stream().map(Lot::copy).toList();
    }

    public List<Lot> getAllLots() {
        List<Lot> all = new ArrayList<>();
        for (List<Lot> symbolLots : lots.values()) {
            symbolLots.forEach(lot -> all.add(lot.copy()));
        }
        return all;
    }

    public Set<String> getHeldSymbols() {
        return Collections.unmodifiableSet(lots.keySet());
    }

    public Optional<Position> getPosition(String symbol, double price) {
        if (!lots.containsKey(symbol)) {
            return Optional.empty();
        }
        return Optional.of(buildPosition(symbol, price));
    }

    /** One position per held symbol; symbols missing from {@code prices} are valued at zero. */
    public List<Position> getAllPositions(Map<String, Double> prices) {
        List<Position> positions = new ArrayList<>();
        for (String symbol : lots.keySet()) {
            positions.add(buildPosition(symbol, prices.getOrDefault(symbol, 0.0)));
        }
        return positions;
    }

    /** Cash plus the market value of every held symbol that has a price. */
    public double getTotalValue(Map<String, Double> prices) {
        return cash + getPositionsValue(prices);
    }

    public double getPositionsValue(Map<String, Double> prices) {
        double value = 0.0;
        for (String symbol : lots.keySet()) {
            Double price = prices.get(symbol);
            if (price != null) {
                value += getTotalQuantity(symbol) * price;
            }
        }
        return value;
    }

    /** Market value of each held symbol as a fraction of total value. Empty when total value is not positive. */
    public Map<String, Double> getCurrentWeights(Map<String, Double> prices) {
        double totalValue = getTotalValue(prices);
        Map<String, Double> weights = new LinkedHashMap<>();
        if (totalValue <= 0) {
            return weights;
        }
        for (Position position : getAllPositions(prices)) {
            weights.put(position.getSymbol(), position.getMarketValue() / totalValue);
        }
        return weights;
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<WashSaleRecord> getWashSales() {
        return Collections.unmodifiableList(washSales);
    }

    public int getWashSaleCount(int year) {
        return (int) washSales.stream()
                .filter(w -> w.getSaleDate().getYear() == year)
                .count();
    }

    /** Snapshot of a year's accumulators. Years without activity yield all zeros. */
    public AnnualTaxAccumulator getAnnual(int year) {
        AnnualTaxAccumulator accumulator = annual.get(year);
        return accumulator != null ? accumulator.copy() : new AnnualTaxAccumulator(year);
    }

    public double getContributions(int year) {
        AnnualTaxAccumulator accumulator = annual.get(year);
        return accumulator != null ? accumulator.getContributions() : 0.0;
    }

    // ---- Internal ----

    private AnnualTaxAccumulator accumulatorFor(int year) {
        return annual.computeIfAbsent(year, AnnualTaxAccumulator::new);
    }

    private boolean hasReplacementPurchase(String symbol, LocalDate saleDate) {
        LocalDate windowStart = saleDate.minusDays(WASH_SALE_DAYS);
        LocalDate windowEnd = saleDate.plusDays(WASH_SALE_DAYS);
        for (Lot candidate : lots.getOrDefault(symbol, List.of())) {
            LocalDate acquired = candidate.getAcquisitionDate();
            if (!acquired.isBefore(windowStart) && !acquired.isAfter(windowEnd) && !acquired.equals(saleDate)) {
                return true;
            }
        }
        return false;
    }

    private Position buildPosition(String symbol, double price) {
        double quantity = getTotalQuantity(symbol);
        double costBasis = getCostBasis(symbol);
        double marketValue = quantity * price;
        return Position.builder()
                .symbol(symbol)
                .quantity(quantity)
                .marketValue(marketValue)
                .costBasis(costBasis)
                .unrealizedGain(marketValue - costBasis)
                .lots(getLots(symbol))
                .build();
    }
}
