package com.backtester.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_STRATEGY("INVALID_STRATEGY", true),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", true),
    INSUFFICIENT_CASH("INSUFFICIENT_CASH", false),
    INSUFFICIENT_SHARES("INSUFFICIENT_SHARES", false),
    NO_PRICE_DATA("NO_PRICE_DATA", false),
    CONTRIBUTION_CAP_EXCEEDED("CONTRIBUTION_CAP_EXCEEDED", false);

    private final String code;

    /** True when the error aborts the whole run instead of a single trade or deposit. */
    private final boolean fatal;
}
