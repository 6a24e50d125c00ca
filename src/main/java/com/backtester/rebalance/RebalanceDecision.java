package com.backtester.rebalance;

import com.backtester.domain.enums.RebalanceReason;
import lombok.Value;

/** Outcome of a trigger evaluation for one simulated day. */
@Value
public class RebalanceDecision {

    private static final RebalanceDecision NONE = new RebalanceDecision(false, RebalanceReason.NONE);

    boolean rebalance;
    RebalanceReason reason;

    public static RebalanceDecision none() {
        return NONE;
    }

    public static RebalanceDecision because(RebalanceReason reason) {
        return new RebalanceDecision(true, reason);
    }
}
