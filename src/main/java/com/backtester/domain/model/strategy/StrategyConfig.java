package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.LotMethod;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declarative description of one backtest: what to hold, for how long, in which account,
 * and how cash flows, dividends, rebalancing and frictions are handled.
 *
 * <p>Structural validity (non-empty universe, ordered period, positive initial cash) is
 * checked by StrategyValidator before any simulation starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyConfig {

    @Builder.Default
    private String name = "Untitled";

    @Builder.Default
    private List<String> symbols = new ArrayList<>();

    private LocalDate startDate;
    private LocalDate endDate;
    private double initialCash;

    @Builder.Default
    private AccountConfig account = new AccountConfig();

    /** Null when the strategy has no scheduled deposits. */
    private DepositConfig deposits;

    @Builder.Default
    private DividendConfig dividends = new DividendConfig();

    @Builder.Default
    private RebalancingConfig rebalancing = new RebalancingConfig();

    @Builder.Default
    private LotMethod lotMethod = LotMethod.HIFO;

    @Builder.Default
    private FrictionsConfig frictions = new FrictionsConfig();

    @Builder.Default
    private PositionSizingConfig positionSizing = new PositionSizingConfig();

    /** Symbols simulated as buy-and-hold benchmarks with the same cash flows. */
    @Builder.Default
    private List<String> benchmarks = new ArrayList<>(List.of("SPY"));
}
