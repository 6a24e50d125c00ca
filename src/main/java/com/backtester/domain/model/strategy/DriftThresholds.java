package com.backtester.domain.model.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Drift trigger thresholds as fractions. Either may be null (channel disabled).
 * absPct 0.05 fires when any weight is 5 points off target; relPct 0.25 fires when any
 * weight is 25% off its own target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftThresholds {

    private Double absPct;
    private Double relPct;
}
