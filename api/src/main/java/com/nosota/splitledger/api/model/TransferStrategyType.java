package com.nosota.splitledger.api.model;

/**
 * Strategy that turns balances into payable transfers.
 */
public enum TransferStrategyType {
    /**
     * At most one transfer per pair of people, netting their mutual debts.
     * Each transfer traces back to the expenses the two people shared.
     */
    PAIRWISE_NET,

    /**
     * Legacy greedy matching of largest creditor with largest debtor over net balances.
     * Retained for compatibility; produces few transfers but they do not map to specific expenses.
     */
    GREEDY_MINIMAL
}
