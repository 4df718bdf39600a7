package com.nosota.splitledger.api.model;

/**
 * Subtotal that a percentage-based extra is computed against.
 *
 * <p>Extras are applied in a fixed order (discounts, tax, fees, tip), so a base is only
 * available to extras applied after the stage that produces it.
 */
public enum PercentBase {
    PRE_TAX_ITEM_SUBTOTAL(0),
    TAXABLE_ITEMS_ONLY(0),
    POST_DISCOUNT(1),
    POST_TAX(2),
    POST_FEES(3);

    private final int stage;

    PercentBase(int stage) {
        this.stage = stage;
    }

    /**
     * Number of extra stages that must already be applied before this base is known:
     * 0 = none, 1 = discounts, 2 = discounts and tax, 3 = discounts, tax and fees.
     */
    public int stage() {
        return stage;
    }
}
