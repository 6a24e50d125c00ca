package com.backtester.domain.model.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Trading costs: flat commission per trade, slippage in basis points of notional, fund expense drag. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FrictionsConfig {

    @Builder.Default
    private double commissionPerTrade = 0.0;

    @Builder.Default
    private double slippageBps = 5.0;

    /** Apply each symbol's published expense ratio as a daily drag on cost basis. */
    @Builder.Default
    private boolean useActualExpenseRatio = true;

    public double getSlippagePct() {
        return slippageBps / 10_000.0;
    }
}
