package com.backtester.calendar;

/**
 * Classifies an entry on the exchange holiday calendar.
 *
 * <p>FULL_HOLIDAY means no trading at all. EARLY_CLOSE (e.g. the day after Thanksgiving)
 * still counts as a trading day.
 */
public enum HolidayType {

    /** Full day holiday, no trading. */
    FULL_HOLIDAY,

    /** Shortened session that closes at 13:00 but still trades. */
    EARLY_CLOSE
}
