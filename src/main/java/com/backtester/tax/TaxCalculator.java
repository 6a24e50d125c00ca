package com.backtester.tax;

import com.backtester.domain.enums.AccountType;
import com.backtester.domain.model.Position;
import com.backtester.domain.model.strategy.TaxConfig;
import com.backtester.portfolio.AnnualTaxAccumulator;
import com.backtester.portfolio.Portfolio;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a year's realized gains and income into a tax bill.
 *
 * <p>Rates per bucket:
 * <ul>
 *   <li>Short-term gains, ordinary dividends, interest: federal ordinary + state</li>
 *   <li>Long-term gains, qualified dividends: federal LTCG + state</li>
 * </ul>
 * Net losses in a bucket contribute zero tax. Only TAXABLE accounts accrue anything;
 * every other account type yields an empty summary.
 */
public class TaxCalculator {

    private static final Logger log = LoggerFactory.getLogger(TaxCalculator.class);

    private final TaxConfig taxConfig;

    public TaxCalculator(TaxConfig taxConfig) {
        this.taxConfig = taxConfig;
    }

    /** Reads the year's accumulators; does not mutate the ledger. */
    public TaxSummary calculateAnnualTax(int year, Portfolio portfolio) {
        if (!portfolio.getAccountType().isTaxable()) {
            return TaxSummary.empty(year);
        }

        AnnualTaxAccumulator annual = portfolio.getAnnual(year);
        double ordinaryRate = taxConfig.getOrdinaryRate();
        double longTermRate = taxConfig.getLongTermRate();

        double shortTermTax = Math.max(0.0, annual.getRealizedShortTerm()) * ordinaryRate;
        double longTermTax = Math.max(0.0, annual.getRealizedLongTerm()) * longTermRate;
        double dividendTax = annual.getQualifiedDividends() * longTermRate + annual.getOrdinaryDividends() * ordinaryRate;
        double interestTax = annual.getInterest() * ordinaryRate;

        return TaxSummary.builder()
                .year(year)
                .shortTermGains(annual.getRealizedShortTerm())
                .longTermGains(annual.getRealizedLongTerm())
                .qualifiedDividends(annual.getQualifiedDividends())
                .ordinaryDividends(annual.getOrdinaryDividends())
                .interest(annual.getInterest())
                .shortTermTax(shortTermTax)
                .longTermTax(longTermTax)
                .dividendTax(dividendTax)
                .interestTax(interestTax)
                .totalTax(shortTermTax + longTermTax + dividendTax + interestTax)
                .washSaleCount(portfolio.getWashSaleCount(year))
                .build();
    }

    /**
     * Computes the year's bill and, unless paid from outside the account, deducts it from
     * ledger cash.
     */
    public TaxSummary applyYearEndTax(int year, Portfolio portfolio, boolean payFromExternal) {
        TaxSummary summary = calculateAnnualTax(year, portfolio);
        if (summary.getTotalTax() > 0 && !payFromExternal) {
            portfolio.deductTax(summary.getTotalTax(), year);
            log.info(
                    "Year-end tax {}: total={} (st={}, lt={}, div={}, int={}) cash={}",
                    year,
                    summary.getTotalTax(),
                    summary.getShortTermTax(),
                    summary.getLongTermTax(),
                    summary.getDividendTax(),
                    summary.getInterestTax(),
                    portfolio.getCash());
        } else if (summary.getTotalTax() > 0) {
            log.info("Year-end tax {}: total={} paid from external funds", year, summary.getTotalTax());
        }
        return summary;
    }

    /**
     * Value of the account if liquidated today, net of taxes.
     * <ul>
     *   <li>Roth IRA and 529: unchanged</li>
     *   <li>Traditional IRA: whole balance reduced by the withdrawal rate</li>
     *   <li>Taxable: long-term rate charged on positive unrealized gains only</li>
     * </ul>
     */
    public double calculateAfterTaxValue(Portfolio portfolio, Map<String, Double> prices) {
        double totalValue = portfolio.getTotalValue(prices);
        AccountType accountType = portfolio.getAccountType();

        return switch (accountType) {
            case TRADITIONAL_IRA -> totalValue * (1 - taxConfig.getWithdrawalTaxRateForIra());
            case TAXABLE -> {
                double unrealizedGains = portfolio.getAllPositions(prices).stream()
                        .mapToDouble(Position::getUnrealizedGain)
                        .filter(gain -> gain > 0)
                        .sum();
                yield totalValue - unrealizedGains * taxConfig.getLongTermRate();
            }
            default -> totalValue;
        };
    }

    /** Tax paid as a fraction of the year-end portfolio value; zero when the value is not positive. */
    public static double calculateTaxDrag(TaxSummary summary, double yearEndValue) {
        if (yearEndValue <= 0) {
            return 0.0;
        }
        return summary.getTotalTax() / yearEndValue;
    }
}
