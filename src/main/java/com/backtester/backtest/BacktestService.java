package com.backtester.backtest;

import com.backtester.calendar.TradingCalendar;
import com.backtester.domain.model.strategy.StrategyConfig;
import com.backtester.exception.MarketDataException;
import com.backtester.marketdata.MarketDataLoader;
import com.backtester.marketdata.SymbolMarketData;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for running backtests.
 *
 * <p>A run is validated and its market data loaded on the calling thread. The strategy
 * simulation and each benchmark simulation then execute as independent tasks on the
 * backtest executor; they share no mutable state apart from the run's warning log.
 * {@link #compare} submits several strategies at once the same way.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final StrategyValidator strategyValidator;
    private final MarketDataLoader marketDataLoader;
    private final BacktestRunner backtestRunner;
    private final BenchmarkSimulator benchmarkSimulator;
    private final TradingCalendar tradingCalendar;
    private final Executor backtestExecutor;

    public BacktestService(
            StrategyValidator strategyValidator,
            MarketDataLoader marketDataLoader,
            BacktestRunner backtestRunner,
            BenchmarkSimulator benchmarkSimulator,
            TradingCalendar tradingCalendar,
            @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.strategyValidator = strategyValidator;
        this.marketDataLoader = marketDataLoader;
        this.backtestRunner = backtestRunner;
        this.benchmarkSimulator = benchmarkSimulator;
        this.tradingCalendar = tradingCalendar;
        this.backtestExecutor = backtestExecutor;
    }

    public BacktestResult run(StrategyConfig config) {
        return run(config, BacktestProgressListener.NOOP);
    }

    /**
     * Runs one strategy and its benchmarks.
     *
     * @throws com.backtester.exception.InvalidStrategyException if the strategy is structurally invalid
     * @throws MarketDataException if none of the strategy's symbols has data
     */
    public BacktestResult run(StrategyConfig config, BacktestProgressListener listener) {
        PreparedRun prepared = prepare(config);
        SubmittedRun submitted = submit(prepared, listener);
        return collect(submitted);
    }

    /**
     * Runs several independent strategies in parallel. Results are returned in input order.
     * All strategies are validated and loaded before any simulation starts.
     */
    public List<BacktestResult> compare(List<StrategyConfig> configs) {
        log.info("Comparing {} strategies", configs.size());
        List<PreparedRun> prepared = new ArrayList<>();
        for (StrategyConfig config : configs) {
            prepared.add(prepare(config));
        }

        List<SubmittedRun> submitted = new ArrayList<>();
        for (PreparedRun run : prepared) {
            submitted.add(submit(run, BacktestProgressListener.NOOP));
        }

        List<BacktestResult> results = new ArrayList<>();
        for (SubmittedRun run : submitted) {
            results.add(collect(run));
        }
        return results;
    }

    private PreparedRun prepare(StrategyConfig config) {
        strategyValidator.validate(config);

        WarningLog warnings = new WarningLog();
        Set<String> symbols = new LinkedHashSet<>(config.getSymbols());
        if (config.getBenchmarks() != null) {
            symbols.addAll(config.getBenchmarks());
        }

        Map<String, SymbolMarketData> loaded = marketDataLoader.load(
                symbols,
                config.getStartDate(),
                config.getEndDate(),
                config.getFrictions().isUseActualExpenseRatio(),
                warnings);

        Map<String, SymbolMarketData> strategyData = new LinkedHashMap<>();
        for (String symbol : config.getSymbols()) {
            SymbolMarketData data = loaded.get(symbol);
            if (data != null) {
                strategyData.put(symbol, data);
            }
        }
        if (strategyData.isEmpty()) {
            throw new MarketDataException("No market data loaded for any of " + config.getSymbols());
        }

        List<LocalDate> tradingDays = tradingCalendar.tradingDays(config.getStartDate(), config.getEndDate());
        return new PreparedRun(config, strategyData, loaded, tradingDays, warnings);
    }

    private SubmittedRun submit(PreparedRun prepared, BacktestProgressListener listener) {
        StrategyConfig config = prepared.getConfig();
        CompletableFuture<BacktestResult> strategy = CompletableFuture.supplyAsync(
                () -> backtestRunner.run(config, prepared.getStrategyData(), prepared.getWarnings(), listener),
                backtestExecutor);

        Map<String, CompletableFuture<BenchmarkResult>> benchmarks = new LinkedHashMap<>();
        if (config.getBenchmarks() != null) {
            DepositSchedule depositSchedule = new DepositSchedule(config.getDeposits(), tradingCalendar);
            for (String symbol : config.getBenchmarks()) {
                SymbolMarketData data = prepared.getAllData().get(symbol);
                if (data == null) {
                    prepared.getWarnings().add("No benchmark data for " + symbol);
                    continue;
                }
                benchmarks.put(
                        symbol,
                        CompletableFuture.supplyAsync(
                                () -> benchmarkSimulator.simulate(
                                        symbol, data, prepared.getTradingDays(), config.getInitialCash(), depositSchedule),
                                backtestExecutor));
            }
        }
        return new SubmittedRun(prepared, strategy, benchmarks);
    }

    private BacktestResult collect(SubmittedRun submitted) {
        WarningLog warnings = submitted.getPrepared().getWarnings();

        Map<String, BenchmarkResult> benchmarkResults = new LinkedHashMap<>();
        submitted.getBenchmarks().forEach((symbol, future) -> {
            try {
                benchmarkResults.put(symbol, future.join());
            } catch (CompletionException e) {
                warnings.add("Benchmark " + symbol + " failed: " + e.getCause().getMessage());
            }
        });

        BacktestResult result;
        try {
            result = submitted.getStrategy().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        return result.toBuilder()
                .benchmarks(benchmarkResults)
                .warnings(warnings.asList())
                .build();
    }

    @Value
    private static class PreparedRun {
        StrategyConfig config;
        Map<String, SymbolMarketData> strategyData;
        Map<String, SymbolMarketData> allData;
        List<LocalDate> tradingDays;
        WarningLog warnings;
    }

    @Value
    private static class SubmittedRun {
        PreparedRun prepared;
        CompletableFuture<BacktestResult> strategy;
        Map<String, CompletableFuture<BenchmarkResult>> benchmarks;
    }
}
