package com.backtester.marketdata;

import com.backtester.domain.model.Bar;
import com.backtester.domain.model.DividendEvent;
import com.backtester.domain.model.SplitEvent;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Getter;

/**
 * Materialized, read-only market data for one symbol. Built before the simulation starts;
 * the daily loop only reads from it.
 */
@Getter
public class SymbolMarketData {

    private final String symbol;
    private final NavigableMap<LocalDate, Bar> bars;
    private final Map<LocalDate, List<DividendEvent>> dividendsByExDate;
    private final List<SplitEvent> splits;
    private final double expenseRatio;

    public SymbolMarketData(
            String symbol,
            List<Bar> bars,
            List<DividendEvent> dividends,
            List<SplitEvent> splits,
            double expenseRatio) {
        this.symbol = symbol;
        TreeMap<LocalDate, Bar> byDate = new TreeMap<>();
        for (Bar bar : bars) {
            byDate.put(bar.getDate(), bar);
        }
        this.bars = Collections.unmodifiableNavigableMap(byDate);

        Map<LocalDate, List<DividendEvent>> byExDate = new LinkedHashMap<>();
        for (DividendEvent dividend : dividends) {
            byExDate.computeIfAbsent(dividend.getExDate(), d -> new ArrayList<>()).add(dividend);
        }
        this.dividendsByExDate = Collections.unmodifiableMap(byExDate);
        this.splits = List.copyOf(splits);
        this.expenseRatio = expenseRatio;
    }

    /** Adjusted close on the given date, or null when there is no bar for it. */
    public Double priceOn(LocalDate date) {
        Bar bar = bars.get(date);
        return bar != null ? bar.getAdjClose() : null;
    }

    public List<DividendEvent> dividendsOn(LocalDate exDate) {
        return dividendsByExDate.getOrDefault(exDate, List.of());
    }
}
