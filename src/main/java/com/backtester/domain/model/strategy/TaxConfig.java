package com.backtester.domain.model.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marginal tax rates and wash-sale settings for a taxable account.
 *
 * <p>Defaults:
 * <ul>
 *   <li>federalOrdinary: 0.32 (short-term gains, ordinary dividends, interest)</li>
 *   <li>federalLtcg: 0.15 (long-term gains, qualified dividends)</li>
 *   <li>state: 0.06 (added to both federal rates)</li>
 *   <li>qualifiedDividendPct: 0.8 (used when a dividend event carries no fraction)</li>
 *   <li>withdrawalTaxRateForIra: 0.25 (after-tax haircut on a Traditional IRA balance)</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxConfig {

    @Builder.Default
    private double federalOrdinary = 0.32;

    @Builder.Default
    private double federalLtcg = 0.15;

    @Builder.Default
    private double state = 0.06;

    @Builder.Default
    private double qualifiedDividendPct = 0.8;

    @Builder.Default
    private boolean applyWashSale = true;

    /** When true, year-end tax is reported but paid from outside the account. */
    @Builder.Default
    private boolean payTaxesFromExternal = false;

    @Builder.Default
    private double withdrawalTaxRateForIra = 0.25;

    public double getOrdinaryRate() {
        return federalOrdinary + state;
    }

    public double getLongTermRate() {
        return federalLtcg + state;
    }
}
