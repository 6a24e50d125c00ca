package com.backtester.domain.model;

import com.backtester.domain.enums.TradeAction;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An executed ledger event: buy, sell, dividend or dividend reinvestment. Immutable once
 * appended to the trade log.
 *
 * <p>{@code netCashImpact} is signed from the account's point of view: negative for buys
 * and DRIP purchases (cash out), positive for sells and dividends (cash in).
 */
@Value
@Builder
public class Trade {

    String tradeId;
    LocalDate date;
    String symbol;
    TradeAction action;
    double quantity;
    double price;
    double commission;
    double slippage;
    double netCashImpact;

    /** Lots created (buys) or relieved (sells) by this trade. */
    @Singular
    List<String> lotIds;

    String notes;
}
