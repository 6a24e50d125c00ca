package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.DepositCadence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepositConfig {

    @Builder.Default
    private DepositCadence cadence = DepositCadence.NONE;

    private double amount;

    public boolean isActive() {
        return cadence != DepositCadence.NONE && amount > 0;
    }
}
