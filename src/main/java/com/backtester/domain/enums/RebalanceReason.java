package com.backtester.domain.enums;

public enum RebalanceReason {
    NONE,
    CALENDAR,
    DRIFT,
    DEPOSIT,
    INITIAL
}
