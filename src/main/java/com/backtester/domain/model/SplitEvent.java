package com.backtester.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Stock split (2.0 = 2-for-1). Informational only: adjusted closes already reflect splits. */
@Value
@Builder
public class SplitEvent {

    LocalDate exDate;
    double ratio;
}
