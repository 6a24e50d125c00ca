package com.backtester.calendar;

/**
 * How a calendar date is snapped onto a trading day.
 *
 * <p>FIRST_BUSINESS_DAY / LAST_BUSINESS_DAY keep the date when it already trades and
 * otherwise move forward / backward. NEXT / PREVIOUS always move.
 */
public enum AlignmentRule {
    FIRST_BUSINESS_DAY,
    LAST_BUSINESS_DAY,
    NEXT,
    PREVIOUS
}
