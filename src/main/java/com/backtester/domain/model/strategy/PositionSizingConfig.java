package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.WeightingMethod;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionSizingConfig {

    @Builder.Default
    private WeightingMethod method = WeightingMethod.EQUAL_WEIGHT;

    /** Raw weights for CUSTOM_WEIGHTS. Normalized to sum to 1 before use. */
    @Builder.Default
    private Map<String, Double> customWeights = new LinkedHashMap<>();
}
