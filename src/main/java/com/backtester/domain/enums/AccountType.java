package com.backtester.domain.enums;

/**
 * Account wrapper the simulated portfolio lives in. Drives lot selection, wash-sale
 * enforcement, realized-gain accrual, contribution caps and after-tax valuation.
 */
public enum AccountType {
    TAXABLE,
    TRADITIONAL_IRA,
    ROTH_IRA,
    PLAN_529;

    /** Only taxable accounts accrue realized gains, dividends and interest for annual tax. */
    public boolean isTaxable() {
        return this == TAXABLE;
    }
}
