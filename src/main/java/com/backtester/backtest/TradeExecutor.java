package com.backtester.backtest;

import com.backtester.domain.enums.OrderSide;
import com.backtester.domain.model.Trade;
import com.backtester.domain.model.TradeIntent;
import com.backtester.domain.model.strategy.FrictionsConfig;
import com.backtester.exception.BaseException;
import com.backtester.exception.InsufficientSharesException;
import com.backtester.exception.NoPriceDataException;
import com.backtester.portfolio.Portfolio;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes planned trade intents against the ledger at the day's prices, applying
 * commission and slippage.
 *
 * <p>Buys that would consume 99.99% or more of available cash are shrunk to the largest
 * affordable quantity. Quantities at or below 1e-4 shares are skipped. A failure whose
 * error code is not fatal is recorded in the warning log and execution moves on to the
 * next intent; a fatal one propagates and ends the run.
 */
public class TradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(TradeExecutor.class);

    public static final double MIN_QUANTITY = 1e-4;

    /** Fraction of cash a clamped buy may spend; the rest absorbs rounding. */
    public static final double CASH_BUFFER = 0.9999;

    private final FrictionsConfig frictions;

    public TradeExecutor(FrictionsConfig frictions) {
        this.frictions = frictions;
    }

    public List<Trade> execute(
            Portfolio portfolio,
            List<TradeIntent> intents,
            Map<String, Double> prices,
            LocalDate date,
            WarningLog warnings) {
        List<Trade> executed = new ArrayList<>();
        for (TradeIntent intent : intents) {
            if (intent.getQuantity() <= MIN_QUANTITY) {
                continue;
            }
            Double price = prices.get(intent.getSymbol());
            if (price == null || price <= 0) {
                warnings.add(new NoPriceDataException(intent.getSymbol(), date).getMessage()
                        + ", skipping " + intent.getSide());
                continue;
            }

            try {
                Trade trade = intent.getSide() == OrderSide.BUY
                        ? executeBuy(portfolio, intent, price, date)
                        : executeSell(portfolio, intent, price, date);
                if (trade != null) {
                    executed.add(trade);
                }
            } catch (InsufficientSharesException e) {
                log.error("Planned sell exceeds holdings on {}: {}", date, e.getMessage());
                warnings.add(failureMessage(date, intent, e));
            } catch (BaseException e) {
                if (e.isFatal()) {
                    log.error("Aborting run on {}: {} {}", date, e.getErrorCode(), e.getMessage());
                    throw e;
                }
                warnings.add(failureMessage(date, intent, e));
            } catch (RuntimeException e) {
                warnings.add(failureMessage(date, intent, e));
            }
        }
        return executed;
    }

    private Trade executeBuy(Portfolio portfolio, TradeIntent intent, double price, LocalDate date) {
        double slippagePct = frictions.getSlippagePct();
        double commission = frictions.getCommissionPerTrade();
        double quantity = intent.getQuantity();

        double totalCost = quantity * price + commission + quantity * price * slippagePct;
        double available = portfolio.getCash() * CASH_BUFFER;
        if (totalCost >= available) {
            double affordable = Math.max(0.0, (available - commission) / (price * (1 + slippagePct)));
            log.debug("Clamping BUY {} on {} from {} to {} shares", intent.getSymbol(), date, quantity, affordable);
            quantity = affordable;
        }
        if (quantity <= MIN_QUANTITY) {
            return null;
        }
        double slippage = quantity * price * slippagePct;
        return portfolio.buy(intent.getSymbol(), quantity, price, date, commission, slippage);
    }

    private Trade executeSell(Portfolio portfolio, TradeIntent intent, double price, LocalDate date) {
        double slippage = intent.getQuantity() * price * frictions.getSlippagePct();
        return portfolio.sell(
                intent.getSymbol(), intent.getQuantity(), price, date, frictions.getCommissionPerTrade(), slippage);
    }

    private static String failureMessage(LocalDate date, TradeIntent intent, Exception e) {
        return String.format(
                "Trade failed on %s: %s %.4f %s - %s",
                date, intent.getSide(), intent.getQuantity(), intent.getSymbol(), e.getMessage());
    }
}
