package com.backtester.domain.model.strategy;

import com.backtester.domain.enums.AccountType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Annual IRA/Roth contribution limits (IRS 2024 figures). Taxable and 529 accounts are
 * uncapped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionCaps {

    @Builder.Default
    private boolean enforce = true;

    @Builder.Default
    private double ira = 7000;

    @Builder.Default
    private double iraCatchUp = 1000;

    @Builder.Default
    private double roth = 7000;

    @Builder.Default
    private double rothCatchUp = 1000;

    /** Account holder is 50 or older and may add the catch-up amount. */
    @Builder.Default
    private boolean catchUpEligible = false;

    /**
     * Returns the annual contribution cap for the account type, or
     * {@link Double#POSITIVE_INFINITY} when no cap applies.
     */
    public double annualCapFor(AccountType accountType) {
        if (!enforce) {
            return Double.POSITIVE_INFINITY;
        }
        return switch (accountType) {
            case TRADITIONAL_IRA -> ira + (catchUpEligible ? iraCatchUp : 0.0);
            case ROTH_IRA -> roth + (catchUpEligible ? rothCatchUp : 0.0);
            default -> Double.POSITIVE_INFINITY;
        };
    }
}
