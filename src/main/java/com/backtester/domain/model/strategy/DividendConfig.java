package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.DividendMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendConfig {

    @Builder.Default
    private DividendMode mode = DividendMode.DRIP;
}
