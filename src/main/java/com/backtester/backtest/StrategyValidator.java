package com.backtester.backtest;

import com.backtester.domain.model.strategy.DepositConfig;
import com.backtester.domain.model.strategy.DriftThresholds;
import com.backtester.domain.model.strategy.PositionSizingConfig;
import com.backtester.domain.model.strategy.StrategyConfig;
import com.backtester.domain.model.strategy.TaxConfig;
import com.backtester.exception.InvalidStrategyException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Rejects structurally invalid strategies before any data is loaded. Everything that can
 * go wrong later in a run is handled as a warning instead.
 */
@Component
public class StrategyValidator {

    public void validate(StrategyConfig config) {
        if (config == null) {
            throw new InvalidStrategyException("Strategy config is required");
        }
        if (config.getSymbols() == null || config.getSymbols().isEmpty()) {
            throw new InvalidStrategyException(
                    "Strategy '" + config.getName() + "' has an empty universe", Map.of("name", config.getName()));
        }
        if (config.getStartDate() == null || config.getEndDate() == null) {
            throw new InvalidStrategyException("Start and end dates are required");
        }
        if (config.getEndDate().isBefore(config.getStartDate())) {
            throw new InvalidStrategyException(
                    "End date " + config.getEndDate() + " is before start date " + config.getStartDate(),
                    Map.of("startDate", config.getStartDate(), "endDate", config.getEndDate()));
        }
        if (config.getInitialCash() <= 0) {
            throw new InvalidStrategyException(
                    "Initial cash must be positive, got " + config.getInitialCash(),
                    Map.of("initialCash", config.getInitialCash()));
        }

        DepositConfig deposits = config.getDeposits();
        if (deposits != null && deposits.getAmount() < 0) {
            throw new InvalidStrategyException("Deposit amount must not be negative, got " + deposits.getAmount());
        }

        PositionSizingConfig sizing = config.getPositionSizing();
        if (sizing != null && sizing.getCustomWeights() != null) {
            sizing.getCustomWeights().forEach((symbol, weight) -> {
                if (weight == null || weight < 0) {
                    throw new InvalidStrategyException(
                            "Custom weight for " + symbol + " must not be negative", Map.of("symbol", symbol));
                }
            });
        }

        DriftThresholds drift = config.getRebalancing() != null ? config.getRebalancing().getDrift() : null;
        if (drift != null
                && ((drift.getAbsPct() != null && drift.getAbsPct() < 0)
                        || (drift.getRelPct() != null && drift.getRelPct() < 0))) {
            throw new InvalidStrategyException("Drift thresholds must not be negative");
        }

        TaxConfig tax = config.getAccount() != null ? config.getAccount().getTax() : null;
        if (tax != null) {
            checkRate("federalOrdinary", tax.getFederalOrdinary());
            checkRate("federalLtcg", tax.getFederalLtcg());
            checkRate("state", tax.getState());
            checkRate("qualifiedDividendPct", tax.getQualifiedDividendPct());
            checkRate("withdrawalTaxRateForIra", tax.getWithdrawalTaxRateForIra());
        }
    }

    private static void checkRate(String name, double value) {
        if (value < 0 || value > 1) {
            throw new InvalidStrategyException(
                    name + " must be between 0 and 1, got " + value, Map.of("field", name, "value", value));
        }
    }
}
