package com.backtester.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Cash dividend per share, paid to holders of record on the ex-date. */
@Value
@Builder
public class DividendEvent {

    LocalDate exDate;
    LocalDate payDate;

    /** Amount per share. */
    double amount;

    /** Fraction (0..1) of the dividend that is qualified. Null means "use the strategy default". */
    Double qualifiedPct;
}
