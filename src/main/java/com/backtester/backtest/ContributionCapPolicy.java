package com.backtester.backtest;

import com.backtester.domain.model.strategy.AccountConfig;
import com.backtester.exception.ContributionCapExceededException;
import com.backtester.portfolio.Portfolio;
import java.time.LocalDate;

/** Annual contribution limits for IRA and Roth accounts. Other account types are uncapped. */
public class ContributionCapPolicy {

    private final AccountConfig accountConfig;

    public ContributionCapPolicy(AccountConfig accountConfig) {
        this.accountConfig = accountConfig;
    }

    /**
     * @throws ContributionCapExceededException if the deposit would push the year's
     *     contributions above the cap
     */
    public void checkDeposit(Portfolio portfolio, LocalDate date, double amount) {
        double cap = accountConfig.getContributionCaps().annualCapFor(accountConfig.getType());
        double contributed = portfolio.getContributions(date.getYear());
        if (contributed + amount > cap) {
            throw new ContributionCapExceededException(date, amount, contributed, cap);
        }
    }
}
