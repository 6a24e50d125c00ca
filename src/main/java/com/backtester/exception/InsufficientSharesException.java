package com.backtester.exception;

import java.util.Map;

/**
 * A sell asks for more shares than are held. Trade planning never requests more than the
 * held quantity, so this signals a planning bug.
 */
public class InsufficientSharesException extends BaseException {

    public InsufficientSharesException(String symbol, double requested, double held) {
        super(
                ErrorCode.INSUFFICIENT_SHARES,
                String.format("Insufficient shares of %s: need %.6f, have %.6f", symbol, requested, held),
                Map.of("symbol", symbol, "requested", requested, "held", held));
    }
}
