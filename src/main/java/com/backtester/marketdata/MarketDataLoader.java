package com.backtester.marketdata;

import com.backtester.backtest.WarningLog;
import com.backtester.domain.model.Bar;
import com.backtester.domain.model.DividendEvent;
import com.backtester.domain.model.SplitEvent;
import com.backtester.exception.MarketDataException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fetches everything a simulation needs up front, one task per symbol on the backtest
 * executor.
 *
 * <p>Best-effort: a symbol with no bars or a failing provider call is dropped with a
 * warning and the remaining symbols still load. The result preserves the requested
 * symbol order. Tasks report their warnings back instead of writing to the log, so
 * symbols cancelled on timeout leave nothing behind once {@link #load} returns.
 */
@Service
public class MarketDataLoader {

    private static final Logger log = LoggerFactory.getLogger(MarketDataLoader.class);

    private final MarketDataProvider marketDataProvider;
    private final Executor backtestExecutor;
    private final long loadTimeoutSeconds;

    public MarketDataLoader(
            MarketDataProvider marketDataProvider,
            @Qualifier("backtestExecutor") Executor backtestExecutor,
            @Value("${backtester.data.load-timeout-seconds:120}") long loadTimeoutSeconds) {
        this.marketDataProvider = marketDataProvider;
        this.backtestExecutor = backtestExecutor;
        this.loadTimeoutSeconds = loadTimeoutSeconds;
    }

    /**
     * @param includeExpenseRatios when false every symbol gets a zero expense ratio
     */
    public Map<String, SymbolMarketData> load(
            Collection<String> symbols,
            LocalDate start,
            LocalDate end,
            boolean includeExpenseRatios,
            WarningLog warnings) {
        Map<String, CompletableFuture<SymbolLoad>> futures = new LinkedHashMap<>();
        for (String symbol : symbols) {
            if (futures.containsKey(symbol)) {
                continue;
            }
            futures.put(
                    symbol,
                    CompletableFuture.supplyAsync(
                            () -> loadSymbol(symbol, start, end, includeExpenseRatios), backtestExecutor));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .get(loadTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            cancelUnfinished(futures);
            Thread.currentThread().interrupt();
            throw new MarketDataException("Interrupted while loading market data", e);
        } catch (TimeoutException e) {
            log.error("Market data loading timed out after {}s", loadTimeoutSeconds);
        } catch (ExecutionException e) {
            // Reported per symbol below
            log.error("Market data loading did not complete cleanly: {}", e.getMessage());
        }
        cancelUnfinished(futures);

        Map<String, SymbolMarketData> loaded = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        futures.forEach((symbol, future) -> {
            if (future.isCancelled()) {
                warnings.add("Timed out loading data for " + symbol);
                missing.add(symbol);
                return;
            }
            if (future.isCompletedExceptionally()) {
                warnings.add("Error loading data for " + symbol);
                missing.add(symbol);
                return;
            }
            SymbolLoad result = future.join();
            if (result.getWarning() != null) {
                warnings.add(result.getWarning());
            }
            if (result.getData() != null) {
                loaded.put(symbol, result.getData());
            } else {
                missing.add(symbol);
            }
        });

        log.info("Loaded market data for {}/{} symbols ({} to {})", loaded.size(), futures.size(), start, end);
        if (!missing.isEmpty()) {
            log.debug("Symbols without data: {}", missing);
        }
        return loaded;
    }

    private static void cancelUnfinished(Map<String, CompletableFuture<SymbolLoad>> futures) {
        futures.forEach((symbol, future) -> {
            if (!future.isDone() && future.cancel(true)) {
                log.warn("Cancelled market data load for {}", symbol);
            }
        });
    }

    private SymbolLoad loadSymbol(String symbol, LocalDate start, LocalDate end, boolean includeExpenseRatios) {
        try {
            List<Bar> bars = marketDataProvider.getBars(symbol, start, end);
            if (bars == null || bars.isEmpty()) {
                return new SymbolLoad(null, "No price data for " + symbol);
            }
            List<DividendEvent> dividends = marketDataProvider.getDividends(symbol, start, end);
            List<SplitEvent> splits = marketDataProvider.getSplits(symbol, start, end);
            double expenseRatio = includeExpenseRatios
                    ? marketDataProvider.getExpenseRatio(symbol).orElse(0.0)
                    : 0.0;
            return new SymbolLoad(
                    new SymbolMarketData(
                            symbol,
                            bars,
                            dividends != null ? dividends : List.of(),
                            splits != null ? splits : List.of(),
                            expenseRatio),
                    null);
        } catch (Exception e) {
            return new SymbolLoad(null, "Error loading data for " + symbol + ": " + e.getMessage());
        }
    }

    /** Outcome of one symbol's task: data, a warning, or both absent. */
    @lombok.Value
    private static class SymbolLoad {
        SymbolMarketData data;
        String warning;
    }
}
