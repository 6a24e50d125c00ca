package com.backtester.domain.model;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tax lot: one acquisition batch of a symbol.
 *
 * <p>Quantity and cost basis hold the <em>remaining</em> amounts. A partial sale reduces
 * both proportionally; the ledger removes the lot once its quantity drops to the depletion
 * tolerance. Lots are owned and mutated by the Portfolio only; everything handed out is a copy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lot {

    private String lotId;
    private String symbol;
    private double quantity;

    /** Total remaining cost basis, including the commission and slippage paid on purchase. */
    private double costBasis;

    private LocalDate acquisitionDate;
    private boolean washSale;
    private double washSaleDisallowed;

    public double getCostPerShare() {
        return quantity > 0 ? costBasis / quantity : 0.0;
    }

    public Lot copy() {
        return new Lot(lotId, symbol, quantity, costBasis, acquisitionDate, washSale, washSaleDisallowed);
    }
}
