package com.backtester.tax;

import lombok.Builder;
import lombok.Value;

/**
 * Tax bill for one calendar year, derived from the ledger's accumulators.
 *
 * <p>Gains are reported signed (net losses show as negative); the tax components are
 * never negative since losses do not produce a credit.
 */
@Value
@Builder
public class TaxSummary {

    int year;
    double shortTermGains;
    double longTermGains;
    double qualifiedDividends;
    double ordinaryDividends;
    double interest;

    double shortTermTax;
    double longTermTax;
    double dividendTax;
    double interestTax;
    double totalTax;

    int washSaleCount;

    public static TaxSummary empty(int year) {
        return TaxSummary.builder().year(year).build();
    }
}
