package com.backtester.backtest;

import com.backtester.domain.enums.WeightingMethod;
import com.backtester.domain.model.strategy.PositionSizingConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target portfolio weights for a universe.
 *
 * <p>EQUAL_WEIGHT gives every symbol 1/N. CUSTOM_WEIGHTS normalizes the supplied weights
 * so they sum to 1; symbols without a weight get zero, and an empty or all-zero set falls
 * back to equal weights.
 */
public final class TargetWeights {

    private TargetWeights() {}

    public static Map<String, Double> calculate(List<String> symbols, PositionSizingConfig sizing) {
        if (symbols.isEmpty()) {
            return Map.of();
        }
        if (sizing == null
                || sizing.getMethod() != WeightingMethod.CUSTOM_WEIGHTS
                || sizing.getCustomWeights() == null
                || sizing.getCustomWeights().isEmpty()) {
            return equalWeights(symbols);
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        double total = 0.0;
        for (String symbol : symbols) {
            double weight = sizing.getCustomWeights().getOrDefault(symbol, 0.0);
            weights.put(symbol, weight);
            total += weight;
        }
        if (total <= 0) {
            return equalWeights(symbols);
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            entry.setValue(entry.getValue() / total);
        }
        return weights;
    }

    private static Map<String, Double> equalWeights(List<String> symbols) {
        double weight = 1.0 / symbols.size();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String symbol : symbols) {
            weights.put(symbol, weight);
        }
        return weights;
    }
}
