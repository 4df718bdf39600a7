package com.nosota.splitledger.api.model;

/**
 * How an absolute-value extra (flat tax, fee, discount or tip) is split among assigned people.
 */
public enum AbsoluteSplitMode {
    /**
     * Proportional to each person's item subtotal.
     * Example: 10.00 fee, A has 30.00 of items and B has 20.00 → A pays 6.00, B pays 4.00.
     */
    PROPORTIONAL_TO_ITEM_SUBTOTAL,

    /**
     * Same amount for every person holding at least one item.
     */
    EVEN
}
