package com.backtester.domain.enums;

/** Tax lot relief order used when selling. */
public enum LotMethod {
    FIFO, // First In First Out
    LIFO, // Last In First Out
    HIFO // Highest In First Out (by cost per share)
}
