package com.backtester.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Calendar rebalance cadence. The code is the short form used in strategy files (D/W/M/Q/Y). */
@Getter
@RequiredArgsConstructor
public enum CalendarPeriod {
    DAILY("D"),
    WEEKLY("W"),
    MONTHLY("M"),
    QUARTERLY("Q"),
    YEARLY("Y");

    private final String code;

    public static CalendarPeriod fromCode(String code) {
        for (CalendarPeriod period : values()) {
            if (period.code.equalsIgnoreCase(code) || period.name().equalsIgnoreCase(code)) {
                return period;
            }
        }
        // "A" (annual) is accepted as an alias for yearly
        if ("A".equalsIgnoreCase(code)) {
            return YEARLY;
        }
        throw new IllegalArgumentException("Unknown calendar period: " + code);
    }
}
