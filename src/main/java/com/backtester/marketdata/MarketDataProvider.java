package com.backtester.marketdata;

import com.backtester.domain.model.Bar;
import com.backtester.domain.model.DividendEvent;
import com.backtester.domain.model.SplitEvent;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Source of historical market data for one symbol at a time. Implementations may hit a
 * remote API or read local files; they are called concurrently for different symbols.
 */
public interface MarketDataProvider {

    /** Daily bars between start and end inclusive, ordered by date. Empty when the symbol is unknown. */
    List<Bar> getBars(String symbol, LocalDate start, LocalDate end);

    List<DividendEvent> getDividends(String symbol, LocalDate start, LocalDate end);

    /** Splits are informational only: adjusted closes already reflect them. */
    List<SplitEvent> getSplits(String symbol, LocalDate start, LocalDate end);

    /** Annual expense ratio as a fraction (0.0003 = 3 bps), if the symbol is a fund. */
    Optional<Double> getExpenseRatio(String symbol);
}
