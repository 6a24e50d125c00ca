package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.AccountType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountConfig {

    @Builder.Default
    private AccountType type = AccountType.TAXABLE;

    @Builder.Default
    private TaxConfig tax = new TaxConfig();

    @Builder.Default
    private ContributionCaps contributionCaps = new ContributionCaps();
}
