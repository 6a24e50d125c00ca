package com.backtester.unit.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.backtester.domain.enums.AccountType;
import com.backtester.domain.enums.LotMethod;
import com.backtester.domain.enums.TradeAction;
import com.backtester.domain.model.Lot;
import com.backtester.domain.model.Position;
import com.backtester.domain.model.Trade;
import com.backtester.domain.model.WashSaleRecord;
import com.backtester.exception.ErrorCode;
import com.backtester.exception.InsufficientCashException;
import com.backtester.exception.InsufficientSharesException;
import com.backtester.portfolio.AnnualTaxAccumulator;
import com.backtester.portfolio.Portfolio;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the Portfolio ledger covering buys, lot relief order, wash sales,
 * dividend and deposit accounting, and the cash and quantity invariants.
 */
class PortfolioTest {

    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);
    private static final LocalDate JAN_4 = LocalDate.of(2024, 1, 4);

    private static Portfolio taxable(LotMethod method, boolean washSale) {
        return new Portfolio(100_000, AccountType.TAXABLE, method, washSale);
    }

    @Nested
    @DisplayName("Buying")
    class Buying {

        @Test
        @DisplayName("Debits quantity * price plus frictions and opens a lot with that basis")
        void buyDebitsCashAndCreatesLot() {
            Portfolio portfolio = new Portfolio(10_000, AccountType.TAXABLE, LotMethod.FIFO, true);

            Trade trade = portfolio.buy("SPY", 10, 100, JAN_2, 1.0, 0.5);

            assertThat(portfolio.getCash()).isCloseTo(8_998.5, within(1e-9));
            assertThat(trade.getAction()).isEqualTo(TradeAction.BUY);
            assertThat(trade.getNetCashImpact()).isCloseTo(-1_001.5, within(1e-9));

            List<Lot> lots = portfolio.getLots("SPY");
            assertThat(lots).hasSize(1);
            assertThat(lots.get(0).getCostBasis()).isCloseTo(1_001.5, within(1e-9));
            assertThat(lots.get(0).getAcquisitionDate()).isEqualTo(JAN_2);
            assertThat(trade.getLotIds()).containsExactly(lots.get(0).getLotId());
        }

        @Test
        @DisplayName("Fails without touching state when cash does not cover the cost")
        void insufficientCash() {
            Portfolio portfolio = new Portfolio(1_000, AccountType.TAXABLE, LotMethod.FIFO, true);

            assertThatThrownBy(() -> portfolio.buy("SPY", 10, 100, JAN_2, 1.0, 0.0))
                    .isInstanceOf(InsufficientCashException.class)
                    .satisfies(e -> assertThat(((InsufficientCashException) e).getErrorCode())
                            .isEqualTo(ErrorCode.INSUFFICIENT_CASH));

            assertThat(portfolio.getCash()).isEqualTo(1_000);
            assertThat(portfolio.getTrades()).isEmpty();
            assertThat(portfolio.getLots("SPY")).isEmpty();
        }

        @Test
        @DisplayName("Rejects non-positive quantity")
        void rejectsZeroQuantity() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);

            assertThatThrownBy(() -> portfolio.buy("SPY", 0, 100, JAN_2, 0, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("DRIP buys are logged with the DRIP action")
        void dripAction() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);

            Trade trade = portfolio.buy("SPY", 1.5, 100, JAN_2, 0, 0, TradeAction.DRIP);

            assertThat(trade.getAction()).isEqualTo(TradeAction.DRIP);
            assertThat(portfolio.getTotalQuantity("SPY")).isCloseTo(1.5, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Lot Selection")
    class LotSelection {

        private Portfolio withThreeLots(AccountType accountType, LotMethod method) {
            Portfolio portfolio = new Portfolio(100_000, accountType, method, false);
            portfolio.buy("SPY", 10, 400, JAN_2, 0, 0);
            portfolio.buy("SPY", 10, 450, JAN_3, 0, 0);
            portfolio.buy("SPY", 10, 350, JAN_4, 0, 0);
            return portfolio;
        }

        private double remainingAt(Portfolio portfolio, double costPerShare) {
            return portfolio.getLots("SPY").stream()
                    .filter(lot -> Math.abs(lot.getCostPerShare() - costPerShare) < 1e-9)
                    .mapToDouble(Lot::getQuantity)
                    .sum();
        }

        @Test
        @DisplayName("HIFO in a taxable account sells the highest-cost lot first")
        void hifoSellsHighestCostFirst() {
            Portfolio portfolio = withThreeLots(AccountType.TAXABLE, LotMethod.HIFO);

            portfolio.sell("SPY", 6, 420, LocalDate.of(2024, 6, 3), 0, 0);

            assertThat(remainingAt(portfolio, 450)).isCloseTo(4, within(1e-9));
            assertThat(remainingAt(portfolio, 400)).isCloseTo(10, within(1e-9));
            assertThat(remainingAt(portfolio, 350)).isCloseTo(10, within(1e-9));
            // 6 * (420 - 450)
            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(-180, within(1e-9));
        }

        @Test
        @DisplayName("HIFO in a tax-deferred account falls back to FIFO")
        void hifoInIraIsFifo() {
            Portfolio portfolio = withThreeLots(AccountType.TRADITIONAL_IRA, LotMethod.HIFO);

            portfolio.sell("SPY", 6, 420, LocalDate.of(2024, 6, 3), 0, 0);

            assertThat(remainingAt(portfolio, 400)).isCloseTo(4, within(1e-9));
            assertThat(remainingAt(portfolio, 450)).isCloseTo(10, within(1e-9));
            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isZero();
        }

        @Test
        @DisplayName("LIFO sells the newest lot first and spills into the next")
        void lifoSpillsAcrossLots() {
            Portfolio portfolio = withThreeLots(AccountType.TAXABLE, LotMethod.LIFO);

            portfolio.sell("SPY", 12, 420, LocalDate.of(2024, 6, 3), 0, 0);

            assertThat(remainingAt(portfolio, 350)).isZero();
            assertThat(remainingAt(portfolio, 450)).isCloseTo(8, within(1e-9));
            assertThat(portfolio.getLots("SPY")).hasSize(2);
        }

        @Test
        @DisplayName("Selling the full quantity removes every lot regardless of method")
        void fullSaleRemovesAllLots() {
            for (LotMethod method : LotMethod.values()) {
                Portfolio portfolio = withThreeLots(AccountType.TAXABLE, method);

                portfolio.sell("SPY", 30, 420, LocalDate.of(2024, 6, 3), 0, 0);

                assertThat(portfolio.getLots("SPY")).as(method.name()).isEmpty();
                assertThat(portfolio.getTotalQuantity("SPY")).as(method.name()).isZero();
                assertThat(portfolio.getHeldSymbols()).as(method.name()).doesNotContain("SPY");
            }
        }

        @Test
        @DisplayName("Partial sale reduces the lot's quantity and basis proportionally")
        void partialSaleProportionalBasis() {
            Portfolio portfolio = taxable(LotMethod.FIFO, false);
            portfolio.buy("AGG", 10, 100, JAN_2, 0, 0);

            portfolio.sell("AGG", 4, 120, LocalDate.of(2024, 2, 1), 0, 0);

            Lot lot = portfolio.getLots("AGG").get(0);
            assertThat(lot.getQuantity()).isCloseTo(6, within(1e-9));
            assertThat(lot.getCostBasis()).isCloseTo(600, within(1e-9));
            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(80, within(1e-9));
        }

        @Test
        @DisplayName("Selling more than held fails with InsufficientShares")
        void oversell() {
            Portfolio portfolio = taxable(LotMethod.FIFO, false);
            portfolio.buy("AGG", 10, 100, JAN_2, 0, 0);

            assertThatThrownBy(() -> portfolio.sell("AGG", 10.5, 100, JAN_3, 0, 0))
                    .isInstanceOf(InsufficientSharesException.class);
            assertThatThrownBy(() -> portfolio.sell("VTI", 1, 100, JAN_3, 0, 0))
                    .isInstanceOf(InsufficientSharesException.class);
            assertThat(portfolio.getTotalQuantity("AGG")).isCloseTo(10, within(1e-12));
        }

        @Test
        @DisplayName("Commission and slippage are apportioned out of proceeds")
        void frictionsReduceProceeds() {
            Portfolio portfolio = taxable(LotMethod.FIFO, false);
            portfolio.buy("AGG", 10, 100, JAN_2, 0, 0);
            double cashBefore = portfolio.getCash();

            Trade trade = portfolio.sell("AGG", 10, 110, LocalDate.of(2024, 2, 1), 5, 5);

            assertThat(trade.getNetCashImpact()).isCloseTo(1_090, within(1e-9));
            assertThat(portfolio.getCash()).isCloseTo(cashBefore + 1_090, within(1e-9));
            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(90, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Wash Sales")
    class WashSales {

        private Portfolio lossSaleWithReplacement(boolean enforce) {
            Portfolio portfolio = taxable(LotMethod.FIFO, enforce);
            portfolio.buy("VTI", 10, 100, JAN_2, 0, 0);
            portfolio.buy("VTI", 5, 80, LocalDate.of(2024, 3, 1), 0, 0);
            portfolio.sell("VTI", 10, 80, LocalDate.of(2024, 3, 15), 0, 0);
            return portfolio;
        }

        @Test
        @DisplayName("Loss with a replacement purchase inside 30 days is disallowed")
        void lossDisallowed() {
            Portfolio portfolio = lossSaleWithReplacement(true);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isZero();
            assertThat(portfolio.getWashSales()).hasSize(1);
            assertThat(portfolio.getWashSales().get(0).getDisallowedLoss()).isCloseTo(200, within(1e-9));
            assertThat(portfolio.getWashSales().get(0).getSymbol()).isEqualTo("VTI");
            assertThat(portfolio.getWashSaleCount(2024)).isEqualTo(1);
            assertThat(portfolio.getWashSaleCount(2025)).isZero();
        }

        @Test
        @DisplayName("With enforcement off the full loss is realized")
        void lossRealizedWhenOff() {
            Portfolio portfolio = lossSaleWithReplacement(false);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(-200, within(1e-9));
            assertThat(portfolio.getWashSales()).isEmpty();
        }

        @Test
        @DisplayName("A same-day purchase does not count as a replacement")
        void sameDayPurchaseIgnored() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            LocalDate saleDate = LocalDate.of(2024, 3, 15);
            portfolio.buy("VTI", 10, 100, JAN_2, 0, 0);
            portfolio.buy("VTI", 5, 80, saleDate, 0, 0);

            portfolio.sell("VTI", 10, 80, saleDate, 0, 0);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(-200, within(1e-9));
            assertThat(portfolio.getWashSales()).isEmpty();
        }

        @Test
        @DisplayName("A purchase more than 30 days before the sale does not count")
        void purchaseOutsideWindow() {
            Portfolio portfolio = taxable(LotMethod.HIFO, true);
            portfolio.buy("VTI", 5, 80, JAN_2, 0, 0);
            portfolio.buy("VTI", 10, 100, LocalDate.of(2024, 1, 10), 0, 0);

            // HIFO relieves the 100 lot; the 80 lot was bought 73 days earlier
            portfolio.sell("VTI", 10, 80, LocalDate.of(2024, 3, 15), 0, 0);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(-200, within(1e-9));
        }

        @Test
        @DisplayName("Purchases after the sale do not reclassify an already realized loss")
        void laterPurchaseNotRetroactive() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            portfolio.buy("VTI", 10, 100, JAN_2, 0, 0);
            portfolio.sell("VTI", 10, 80, LocalDate.of(2024, 3, 15), 0, 0);

            portfolio.buy("VTI", 10, 80, LocalDate.of(2024, 3, 20), 0, 0);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isCloseTo(-200, within(1e-9));
            assertThat(portfolio.getWashSales()).isEmpty();
        }

        @Test
        @DisplayName("Wash-sale rules do not apply to tax-deferred accounts")
        void notAppliedToIra() {
            Portfolio portfolio = new Portfolio(100_000, AccountType.ROTH_IRA, LotMethod.FIFO, true);
            portfolio.buy("VTI", 10, 100, JAN_2, 0, 0);
            portfolio.buy("VTI", 5, 80, LocalDate.of(2024, 3, 1), 0, 0);

            portfolio.sell("VTI", 10, 80, LocalDate.of(2024, 3, 15), 0, 0);

            assertThat(portfolio.getWashSales()).isEmpty();
        }

        @Test
        @DisplayName("A lot sold at a loss within 30 days of its own purchase is a wash sale")
        void soldLotInsideItsOwnWindow() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            portfolio.buy("SPY", 10, 400, JAN_2, 0, 0);

            portfolio.sell("SPY", 10, 350, LocalDate.of(2024, 1, 20), 0, 0);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isZero();
            assertThat(portfolio.getWashSales()).hasSize(1);
            assertThat(portfolio.getWashSales().get(0).getDisallowedLoss()).isCloseTo(500, within(1e-9));
            assertThat(portfolio.getLots("SPY")).isEmpty();
        }

        @Test
        @DisplayName("Every recent lot consumed by a FIFO sale has its loss disallowed")
        void saleConsumingTwoRecentLots() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            portfolio.buy("SPY", 10, 400, JAN_2, 0, 0);
            portfolio.buy("SPY", 10, 390, LocalDate.of(2024, 1, 10), 0, 0);

            portfolio.sell("SPY", 20, 360, LocalDate.of(2024, 1, 20), 0, 0);

            assertThat(portfolio.getAnnual(2024).getRealizedShortTerm()).isZero();
            assertThat(portfolio.getWashSales())
                    .extracting(WashSaleRecord::getDisallowedLoss)
                    .containsExactly(400.0, 300.0);
            assertThat(portfolio.getWashSaleCount(2024)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Income, Deposits and Taxes")
    class CashFlows {

        @Test
        @DisplayName("Dividend is split into qualified and ordinary income for taxable accounts")
        void taxableDividend() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            portfolio.buy("SPY", 10, 400, JAN_2, 0, 0);
            double cashBefore = portfolio.getCash();

            Trade trade = portfolio.recordDividend("SPY", 100, LocalDate.of(2024, 3, 20), 0.8);

            AnnualTaxAccumulator annual = portfolio.getAnnual(2024);
            assertThat(portfolio.getCash()).isCloseTo(cashBefore + 100, within(1e-9));
            assertThat(annual.getQualifiedDividends()).isCloseTo(80, within(1e-9));
            assertThat(annual.getOrdinaryDividends()).isCloseTo(20, within(1e-9));
            assertThat(trade.getAction()).isEqualTo(TradeAction.DIVIDEND);
            assertThat(trade.getQuantity()).isCloseTo(10, within(1e-9));
            assertThat(trade.getPrice()).isCloseTo(10, within(1e-9));
        }

        @Test
        @DisplayName("Dividend in a Roth credits cash without accruing income")
        void rothDividend() {
            Portfolio portfolio = new Portfolio(1_000, AccountType.ROTH_IRA, LotMethod.FIFO, true);

            portfolio.recordDividend("SPY", 50, LocalDate.of(2024, 3, 20), 0.8);

            assertThat(portfolio.getCash()).isCloseTo(1_050, within(1e-9));
            assertThat(portfolio.getAnnual(2024).getQualifiedDividends()).isZero();
            assertThat(portfolio.getAnnual(2024).getOrdinaryDividends()).isZero();
        }

        @Test
        @DisplayName("Interest accrues as ordinary income in taxable accounts")
        void interest() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);

            portfolio.recordInterest(25, LocalDate.of(2024, 5, 1));

            assertThat(portfolio.getAnnual(2024).getInterest()).isCloseTo(25, within(1e-9));
            assertThat(portfolio.getCash()).isCloseTo(100_025, within(1e-9));
        }

        @Test
        @DisplayName("Deposits accrue into the year's contributions")
        void deposits() {
            Portfolio portfolio = new Portfolio(1_000, AccountType.TRADITIONAL_IRA, LotMethod.FIFO, true);

            portfolio.addDeposit(500, LocalDate.of(2024, 2, 1));
            portfolio.addDeposit(700, LocalDate.of(2024, 3, 1));
            portfolio.addDeposit(300, LocalDate.of(2025, 1, 2));

            assertThat(portfolio.getContributions(2024)).isCloseTo(1_200, within(1e-9));
            assertThat(portfolio.getContributions(2025)).isCloseTo(300, within(1e-9));
            assertThat(portfolio.getTotalDeposits()).isCloseTo(1_500, within(1e-9));
            assertThat(portfolio.getCash()).isCloseTo(2_500, within(1e-9));
        }

        @Test
        @DisplayName("Tax deduction may push cash below zero")
        void taxCanOverdraw() {
            Portfolio portfolio = new Portfolio(100, AccountType.TAXABLE, LotMethod.FIFO, true);

            portfolio.deductTax(150, 2024);

            assertThat(portfolio.getCash()).isCloseTo(-50, within(1e-9));
            assertThat(portfolio.getTotalTaxesPaid()).isCloseTo(150, within(1e-9));
            assertThat(portfolio.getAnnual(2024).getTaxesPaid()).isCloseTo(150, within(1e-9));
        }

        @Test
        @DisplayName("Expense drag erodes cost basis, not cash")
        void expenseDrag() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            portfolio.buy("SPY", 10, 100, JAN_2, 0, 0);
            double cash = portfolio.getCash();

            portfolio.applyCostBasisDrag("SPY", 0.001);

            assertThat(portfolio.getLots("SPY").get(0).getCostBasis()).isCloseTo(999, within(1e-9));
            assertThat(portfolio.getCash()).isEqualTo(cash);
        }
    }

    @Nested
    @DisplayName("Valuation and Invariants")
    class Invariants {

        @Test
        @DisplayName("Positions report market value, basis and unrealized gain")
        void positions() {
            Portfolio portfolio = new Portfolio(10_000, AccountType.TAXABLE, LotMethod.FIFO, true);
            portfolio.buy("SPY", 10, 400, JAN_2, 0, 0);
            portfolio.buy("AGG", 20, 100, JAN_2, 0, 0);
            Map<String, Double> prices = Map.of("SPY", 420.0, "AGG", 95.0);

            Position spy = portfolio.getPosition("SPY", 420.0).orElseThrow();
            assertThat(spy.getMarketValue()).isCloseTo(4_200, within(1e-9));
            assertThat(spy.getUnrealizedGain()).isCloseTo(200, within(1e-9));

            assertThat(portfolio.getTotalValue(prices)).isCloseTo(4_000 + 4_200 + 1_900, within(1e-9));
            Map<String, Double> weights = portfolio.getCurrentWeights(prices);
            assertThat(weights.get("SPY")).isCloseTo(4_200 / 10_100.0, within(1e-12));
            assertThat(portfolio.getPosition("VTI", 100.0)).isEmpty();
        }

        @Test
        @DisplayName("Cash equals initial cash plus trade cash impacts plus deposits minus taxes")
        void cashInvariant() {
            Portfolio portfolio = taxable(LotMethod.HIFO, true);
            portfolio.buy("SPY", 10, 400, JAN_2, 1, 2);
            portfolio.addDeposit(5_000, JAN_3);
            portfolio.buy("AGG", 30, 100, JAN_3, 1, 1.5);
            portfolio.recordDividend("SPY", 15, LocalDate.of(2024, 3, 20), 0.9);
            portfolio.sell("SPY", 3.5, 410, LocalDate.of(2024, 4, 1), 1, 0.7);
            portfolio.buy("SPY", 0.75, 405, LocalDate.of(2024, 4, 2), 0, 0, TradeAction.DRIP);
            portfolio.sell("AGG", 12.25, 98, LocalDate.of(2024, 5, 1), 0, 0.6);
            portfolio.deductTax(123.45, 2024);

            double tradeImpacts = portfolio.getTrades().stream().mapToDouble(Trade::getNetCashImpact).sum();
            assertThat(portfolio.getCash())
                    .isCloseTo(portfolio.getInitialCash() + tradeImpacts + portfolio.getTotalDeposits()
                            - portfolio.getTotalTaxesPaid(), within(1e-6));
        }

        @Test
        @DisplayName("Held quantity equals the sum of lot quantities after partial sales")
        void quantityInvariant() {
            Portfolio portfolio = taxable(LotMethod.HIFO, false);
            portfolio.buy("SPY", 3.3, 400, JAN_2, 0, 0);
            portfolio.buy("SPY", 2.2, 410, JAN_3, 0, 0);
            portfolio.buy("SPY", 1.1, 390, JAN_4, 0, 0);

            portfolio.sell("SPY", 2.7, 405, LocalDate.of(2024, 2, 1), 0, 0);
            portfolio.sell("SPY", 1.05, 405, LocalDate.of(2024, 2, 2), 0, 0);

            double lotSum = portfolio.getLots("SPY").stream().mapToDouble(Lot::getQuantity).sum();
            assertThat(portfolio.getTotalQuantity("SPY")).isCloseTo(lotSum, within(1e-4));
            assertThat(lotSum).isCloseTo(6.6 - 3.75, within(1e-4));
            assertThat(portfolio.getLots("SPY")).allSatisfy(lot -> assertThat(lot.getQuantity()).isPositive());
        }

        @Test
        @DisplayName("Lots handed out are copies")
        void lotsAreCopies() {
            Portfolio portfolio = taxable(LotMethod.FIFO, true);
            portfolio.buy("SPY", 10, 100, JAN_2, 0, 0);

            portfolio.getLots("SPY").get(0).setQuantity(0);

            assertThat(portfolio.getTotalQuantity("SPY")).isCloseTo(10, within(1e-12));
        }
    }
}
