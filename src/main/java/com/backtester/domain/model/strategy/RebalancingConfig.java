package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.CalendarPeriod;
import com.backtester.domain.enums.RebalanceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalancingConfig {

    @Builder.Default
    private RebalanceType type = RebalanceType.CASHFLOW_ONLY;

    /** Required for CALENDAR; optional for BOTH. */
    private CalendarPeriod calendarPeriod;

    /** Required for DRIFT; optional for BOTH. */
    private DriftThresholds drift;
}
