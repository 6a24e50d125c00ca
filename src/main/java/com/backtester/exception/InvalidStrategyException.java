package com.backtester.exception;

import java.util.Map;

/**
 * Structurally invalid strategy configuration. Raised before the simulation loop starts
 * and aborts the run.
 */
public class InvalidStrategyException extends BaseException {

    public InvalidStrategyException(String message) {
        super(ErrorCode.INVALID_STRATEGY, message);
    }

    public InvalidStrategyException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STRATEGY, message, details);
    }
}
