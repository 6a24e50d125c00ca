package com.backtester.portfolio;

import com.backtester.domain.enums.AccountType;
import com.backtester.domain.enums.LotMethod;
import com.backtester.domain.model.Lot;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.Value;

/**
 * Orders a symbol's lots by the configured relief method and greedily assigns the
 * requested quantity to them. The last lot touched may be partially consumed.
 *
 * <p>HIFO only pays off where gains are taxed, so tax-deferred accounts fall back to FIFO.
 */
public class LotSelector {

    private static final Comparator<Lot> BY_ACQUISITION =
            Comparator.comparing(Lot::getAcquisitionDate);

    private static final Comparator<Lot> BY_COST_PER_SHARE_DESC =
            Comparator.comparingDouble(Lot::getCostPerShare).reversed();

    public List<LotAllocation> select(List<Lot> lots, double quantity, LotMethod method, AccountType accountType) {
        List<Lot> ordered = new ArrayList<>(lots);
        ordered.sort(comparatorFor(method, accountType));

        List<LotAllocation> allocations = new ArrayList<>();
        double remaining = quantity;
        for (Lot lot : ordered) {
            if (remaining <= 0) {
                break;
            }
            double fromLot = Math.min(lot.getQuantity(), remaining);
            allocations.add(new LotAllocation(lot, fromLot));
            remaining -= fromLot;
        }
        return allocations;
    }

    Comparator<Lot> comparatorFor(LotMethod method, AccountType accountType) {
        return switch (method) {
            case LIFO -> BY_ACQUISITION.reversed();
            // Stable sort keeps acquisition order among equal-cost lots
            case HIFO -> accountType.isTaxable() ? BY_COST_PER_SHARE_DESC : BY_ACQUISITION;
            default -> BY_ACQUISITION;
        };
    }

    /** A lot and the quantity to relieve from it. */
    @Value
    public static class LotAllocation {
        Lot lot;
        double quantity;
    }
}
