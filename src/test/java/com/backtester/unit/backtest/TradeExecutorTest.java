package com.backtester.unit.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.backtester.backtest.TradeExecutor;
import com.backtester.backtest.WarningLog;
import com.backtester.domain.enums.AccountType;
import com.backtester.domain.enums.LotMethod;
import com.backtester.domain.enums.TradeAction;
import com.backtester.domain.model.Trade;
import com.backtester.domain.model.TradeIntent;
import com.backtester.domain.model.strategy.FrictionsConfig;
import com.backtester.exception.InsufficientCashException;
import com.backtester.exception.MarketDataException;
import com.backtester.portfolio.Portfolio;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradeExecutor covering frictions, cash clamping on buys and the
 * warning-only failure path.
 */
class TradeExecutorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 2);

    private WarningLog warnings;

    @BeforeEach
    void setUp() {
        warnings = new WarningLog();
    }

    private static Portfolio portfolio(double cash) {
        return new Portfolio(cash, AccountType.TAXABLE, LotMethod.FIFO, true);
    }

    private static TradeExecutor executor(double commission, double slippageBps) {
        return new TradeExecutor(FrictionsConfig.builder()
                .commissionPerTrade(commission)
                .slippageBps(slippageBps)
                .build());
    }

    @Nested
    @DisplayName("Buys")
    class Buys {

        @Test
        @DisplayName("Affordable buy executes at the requested quantity with frictions")
        void affordableBuy() {
            Portfolio portfolio = portfolio(10_000);

            List<Trade> trades = executor(1.0, 10).execute(
                    portfolio, List.of(TradeIntent.buy("SPY", 10)), Map.of("SPY", 100.0), DAY, warnings);

            assertThat(trades).hasSize(1);
            assertThat(trades.get(0).getQuantity()).isEqualTo(10);
            assertThat(trades.get(0).getSlippage()).isCloseTo(1.0, within(1e-9));
            assertThat(portfolio.getCash()).isCloseTo(10_000 - 1_002, within(1e-9));
        }

        @Test
        @DisplayName("Buy exceeding available cash is clamped to 99.99% of the balance")
        void clampedBuy() {
            Portfolio portfolio = portfolio(1_000);

            List<Trade> trades = executor(0, 0).execute(
                    portfolio, List.of(TradeIntent.buy("SPY", 20)), Map.of("SPY", 100.0), DAY, warnings);

            assertThat(trades.get(0).getQuantity()).isCloseTo(9.999, within(1e-9));
            assertThat(portfolio.getCash()).isCloseTo(0.1, within(1e-9));
            assertThat(warnings.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Clamping leaves room for commission and slippage")
        void clampedBuyWithFrictions() {
            Portfolio portfolio = portfolio(1_000);

            List<Trade> trades = executor(1.0, 10).execute(
                    portfolio, List.of(TradeIntent.buy("SPY", 20)), Map.of("SPY", 100.0), DAY, warnings);

            double expected = (1_000 * 0.9999 - 1.0) / (100 * 1.001);
            assertThat(trades.get(0).getQuantity()).isCloseTo(expected, within(1e-9));
            assertThat(portfolio.getCash()).isGreaterThanOrEqualTo(0);
        }

        @Test
        @DisplayName("Cash that cannot cover the commission produces no trade")
        void cashBelowCommission() {
            Portfolio portfolio = portfolio(0.5);

            List<Trade> trades = executor(1.0, 0).execute(
                    portfolio, List.of(TradeIntent.buy("SPY", 1)), Map.of("SPY", 100.0), DAY, warnings);

            assertThat(trades).isEmpty();
            assertThat(portfolio.getCash()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Dust quantities are skipped silently")
        void dustSkipped() {
            Portfolio portfolio = portfolio(1_000);

            List<Trade> trades = executor(0, 0).execute(
                    portfolio, List.of(TradeIntent.buy("SPY", 0.00005)), Map.of("SPY", 100.0), DAY, warnings);

            assertThat(trades).isEmpty();
            assertThat(portfolio.getTrades()).isEmpty();
            assertThat(warnings.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Sells and Failures")
    class SellsAndFailures {

        @Test
        @DisplayName("Sell proceeds are net of commission and slippage")
        void sellWithFrictions() {
            Portfolio portfolio = portfolio(10_000);
            portfolio.buy("SPY", 10, 100, DAY.minusDays(30), 0, 0);

            List<Trade> trades = executor(1.0, 10).execute(
                    portfolio, List.of(TradeIntent.sell("SPY", 5)), Map.of("SPY", 120.0), DAY, warnings);

            assertThat(trades.get(0).getAction()).isEqualTo(TradeAction.SELL);
            assertThat(trades.get(0).getNetCashImpact()).isCloseTo(600 - 0.6 - 1.0, within(1e-9));
            assertThat(portfolio.getTotalQuantity("SPY")).isCloseTo(5, within(1e-9));
        }

        @Test
        @DisplayName("Missing price skips the trade with a warning")
        void missingPrice() {
            Portfolio portfolio = portfolio(1_000);

            List<Trade> trades = executor(0, 0).execute(
                    portfolio, List.of(TradeIntent.buy("AGG", 1)), Map.of("SPY", 100.0), DAY, warnings);

            assertThat(trades).isEmpty();
            assertThat(warnings.asList()).containsExactly("No price data for AGG on 2024-01-02, skipping BUY");
        }

        @Test
        @DisplayName("Overselling is reported as a warning and later intents still execute")
        void oversell() {
            Portfolio portfolio = portfolio(10_000);
            portfolio.buy("SPY", 5, 100, DAY.minusDays(30), 0, 0);

            List<Trade> trades = executor(0, 0).execute(
                    portfolio,
                    List.of(TradeIntent.sell("SPY", 10), TradeIntent.buy("AGG", 10)),
                    Map.of("SPY", 100.0, "AGG", 50.0),
                    DAY,
                    warnings);

            assertThat(trades).extracting(Trade::getSymbol).containsExactly("AGG");
            assertThat(warnings.asList()).hasSize(1);
            assertThat(warnings.asList().get(0)).startsWith("Trade failed on 2024-01-02: SELL 10.0000 SPY - Insufficient shares");
            assertThat(portfolio.getTotalQuantity("SPY")).isCloseTo(5, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Error Severity")
    class ErrorSeverity {

        @Test
        @DisplayName("A non-fatal ledger error becomes a warning")
        void nonFatalBecomesWarning() {
            Portfolio portfolio = mock(Portfolio.class);
            when(portfolio.getCash()).thenReturn(10_000.0);
            when(portfolio.buy(eq("SPY"), anyDouble(), anyDouble(), eq(DAY), anyDouble(), anyDouble()))
                    .thenThrow(new InsufficientCashException("SPY", 1_000, 10));

            List<Trade> trades = executor(0, 0).execute(
                    portfolio, List.of(TradeIntent.buy("SPY", 10)), Map.of("SPY", 100.0), DAY, warnings);

            assertThat(trades).isEmpty();
            assertThat(warnings.asList()).hasSize(1);
            assertThat(warnings.asList().get(0)).startsWith("Trade failed on 2024-01-02: BUY 10.0000 SPY");
        }

        @Test
        @DisplayName("A fatal error aborts execution instead of being logged as a warning")
        void fatalPropagates() {
            Portfolio portfolio = mock(Portfolio.class);
            when(portfolio.getCash()).thenReturn(10_000.0);
            when(portfolio.buy(eq("SPY"), anyDouble(), anyDouble(), eq(DAY), anyDouble(), anyDouble()))
                    .thenThrow(new MarketDataException("Price feed unavailable"));

            assertThatThrownBy(() -> executor(0, 0).execute(
                            portfolio,
                            List.of(TradeIntent.buy("SPY", 10), TradeIntent.buy("AGG", 10)),
                            Map.of("SPY", 100.0, "AGG", 50.0),
                            DAY,
                            warnings))
                    .isInstanceOf(MarketDataException.class)
                    .satisfies(e -> assertThat(((MarketDataException) e).isFatal()).isTrue());
            assertThat(warnings.asList()).isEmpty();
            verify(portfolio, never()).buy(eq("AGG"), anyDouble(), anyDouble(), eq(DAY), anyDouble(), anyDouble());
        }
    }
}
