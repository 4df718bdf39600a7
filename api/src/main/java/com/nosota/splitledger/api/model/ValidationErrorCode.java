package com.nosota.splitledger.api.model;

/**
 * Error taxonomy of the allocation and settlement engines.
 */
public enum ValidationErrorCode {
    // ==================== Itemized allocation ====================

    /** A line item has no assigned participants. */
    UNASSIGNED_ITEM,

    /** Custom item shares do not sum to 1 within tolerance. */
    SHARES_DO_NOT_SUM_TO_ONE,

    /** Custom share keys differ from the assigned users, or a share is negative. */
    INVALID_ASSIGNMENT,

    /** Blank name, non-positive quantity or negative unit price. */
    INVALID_LINE_ITEM,

    /** Malformed tax, tip, fee or discount. */
    INVALID_EXTRA,

    /** Remainder policy PAYER used with a payer who is not a participant. */
    PAYER_NOT_PARTICIPANT,

    /** A participant's computed total is negative. */
    NEGATIVE_TOTAL,

    /** Distributed amounts do not add up to the expense total. Indicates an engine bug. */
    COMPUTATION_MISMATCH,

    /** Tax or tip percentage above the sanity threshold. */
    EXTREME_PERCENTAGE,

    // ==================== Settlement ====================

    /** Expense currency differs from the trip base currency. */
    CURRENCY_MISMATCH,

    /** Sum of net balances is not zero. */
    BALANCE_CONSERVATION_VIOLATION,

    UNKNOWN_TRANSFER_PARTY,

    SELF_TRANSFER,

    DUPLICATE_TRANSFER,

    TRANSFER_BALANCE_MISMATCH,

    NON_POSITIVE_TRANSFER
}
