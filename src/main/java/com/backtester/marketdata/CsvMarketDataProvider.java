package com.backtester.marketdata;

import com.backtester.domain.model.Bar;
import com.backtester.domain.model.DividendEvent;
import com.backtester.domain.model.SplitEvent;
import com.backtester.exception.MarketDataException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reads market data from a local directory of CSV files with headers:
 * <pre>
 *   bars/SPY.csv        date,open,high,low,close,adj_close,volume
 *   dividends/SPY.csv   ex_date,pay_date,amount,qualified_pct
 *   splits/SPY.csv      ex_date,ratio
 *   metadata.csv        symbol,expense_ratio
 * </pre>
 * A missing file means no data of that kind. {@code adj_close} falls back to {@code close}
 * and {@code qualified_pct} may be left empty.
 */
@Component
public class CsvMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvMarketDataProvider.class);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA_WITH_HEADER = CsvSchema.emptySchema().withHeader();

    private final Path dataDirectory;
    private volatile Map<String, Double> expenseRatios;

    public CsvMarketDataProvider(@Value("${backtester.data.directory:data}") String dataDirectory) {
        this.dataDirectory = Paths.get(dataDirectory);
    }

    @Override
    public List<Bar> getBars(String symbol, LocalDate start, LocalDate end) {
        List<Bar> bars = readRows(dataDirectory.resolve("bars").resolve(symbol + ".csv"), row -> {
            double close = Double.parseDouble(row.get("close"));
            return Bar.builder()
                    .date(LocalDate.parse(row.get("date")))
                    .open(Double.parseDouble(row.get("open")))
                    .high(Double.parseDouble(row.get("high")))
                    .low(Double.parseDouble(row.get("low")))
                    .close(close)
                    .adjClose(isBlank(row.get("adj_close")) ? close : Double.parseDouble(row.get("adj_close")))
                    .volume(isBlank(row.get("volume")) ? 0.0 : Double.parseDouble(row.get("volume")))
                    .build();
        });
        bars.removeIf(bar -> bar.getDate().isBefore(start) || bar.getDate().isAfter(end));
        bars.sort(Comparator.comparing(Bar::getDate));
        return bars;
    }

    @Override
    public List<DividendEvent> getDividends(String symbol, LocalDate start, LocalDate end) {
        List<DividendEvent> dividends = readRows(dataDirectory.resolve("dividends").resolve(symbol + ".csv"), row ->
                DividendEvent.builder()
                        .exDate(LocalDate.parse(row.get("ex_date")))
                        .payDate(isBlank(row.get("pay_date")) ? null : LocalDate.parse(row.get("pay_date")))
                        .amount(Double.parseDouble(row.get("amount")))
                        .qualifiedPct(isBlank(row.get("qualified_pct")) ? null : Double.valueOf(row.get("qualified_pct")))
                        .build());
        dividends.removeIf(d -> d.getExDate().isBefore(start) || d.getExDate().isAfter(end));
        return dividends;
    }

    @Override
    public List<SplitEvent> getSplits(String symbol, LocalDate start, LocalDate end) {
        List<SplitEvent> splits = readRows(dataDirectory.resolve("splits").resolve(symbol + ".csv"), row ->
                SplitEvent.builder()
                        .exDate(LocalDate.parse(row.get("ex_date")))
                        .ratio(Double.parseDouble(row.get("ratio")))
                        .build());
        splits.removeIf(s -> s.getExDate().isBefore(start) || s.getExDate().isAfter(end));
        return splits;
    }

    @Override
    public Optional<Double> getExpenseRatio(String symbol) {
        if (expenseRatios == null) {
            Map<String, Double> loaded = new ConcurrentHashMap<>();
            for (Map.Entry<String, Double> entry : readRows(dataDirectory.resolve("metadata.csv"), row ->
                    Map.entry(row.get("symbol"), isBlank(row.get("expense_ratio"))
                            ? 0.0
                            : Double.parseDouble(row.get("expense_ratio"))))) {
                loaded.put(entry.getKey(), entry.getValue());
            }
            expenseRatios = loaded;
        }
        return Optional.ofNullable(expenseRatios.get(symbol));
    }

    private <T> List<T> readRows(Path file, Function<Map<String, String>, T> mapper) {
        List<T> rows = new ArrayList<>();
        if (!Files.exists(file)) {
            return rows;
        }
        try (MappingIterator<Map<String, String>> it =
                CSV_MAPPER.readerForMapOf(String.class).with(SCHEMA_WITH_HEADER).readValues(file.toFile())) {
            while (it.hasNext()) {
                rows.add(mapper.apply(it.next()));
            }
        } catch (IOException | RuntimeException e) {
            throw new MarketDataException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        log.debug("Read {} rows from {}", rows.size(), file);
        return rows;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
