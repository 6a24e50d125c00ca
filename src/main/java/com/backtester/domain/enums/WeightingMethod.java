package com.backtester.domain.enums;

/** How target weights are derived from the universe. */
public enum WeightingMethod {
    EQUAL_WEIGHT,
    CUSTOM_WEIGHTS
}
