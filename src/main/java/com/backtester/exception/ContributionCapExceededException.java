package com.backtester.exception;

import java.time.LocalDate;
import java.util.Map;

public class ContributionCapExceededException extends BaseException {

    public ContributionCapExceededException(LocalDate date, double attempted, double alreadyContributed, double cap) {
        super(
                ErrorCode.CONTRIBUTION_CAP_EXCEEDED,
                String.format(
                        "Contribution cap reached on %s, skipping deposit (deposit $%.2f, contributed $%.2f, cap $%.2f)",
                        date, attempted, alreadyContributed, cap),
                Map.of("date", date, "attempted", attempted, "contributed", alreadyContributed, "cap", cap));
    }
}
