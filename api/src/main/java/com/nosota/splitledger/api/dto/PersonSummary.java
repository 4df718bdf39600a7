package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;

/**
 * Totals of one person across a trip, in the trip base currency.
 *
 * @param userId        Person
 * @param totalPaidBase Sum of expenses the person paid
 * @param totalOwedBase Sum of the person's shares
 * @param netBase       {@code totalPaidBase - totalOwedBase}; positive means the person is owed money
 */
public record PersonSummary(
        String userId,
        BigDecimal totalPaidBase,
        BigDecimal totalOwedBase,
        BigDecimal netBase
) {
}
