package com.backtester.portfolio;

import lombok.Data;

/**
 * Tax-relevant totals for one calendar year. Realized gains are net of disallowed
 * wash-sale losses and may be negative.
 */
@Data
public class AnnualTaxAccumulator {

    private final int year;
    private double contributions;
    private double realizedShortTerm;
    private double realizedLongTerm;
    private double qualifiedDividends;
    private double ordinaryDividends;
    private double interest;
    private double taxesPaid;

    public AnnualTaxAccumulator copy() {
        AnnualTaxAccumulator copy = new AnnualTaxAccumulator(year);
        copy.setContributions(contributions);
        copy.setRealizedShortTerm(realizedShortTerm);
        copy.setRealizedLongTerm(realizedLongTerm);
        copy.setQualifiedDividends(qualifiedDividends);
        copy.setOrdinaryDividends(ordinaryDividends);
        copy.setInterest(interest);
        copy.setTaxesPaid(taxesPaid);
        return copy;
    }
}
