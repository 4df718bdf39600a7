package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;

/**
 * Audit line: how much of one item a participant was charged.
 *
 * @param itemId             Line item id
 * @param itemName           Line item name
 * @param quantity           Item quantity
 * @param unitPrice          Item unit price
 * @param assignedShare      Fraction of the item assigned to the participant (0..1)
 * @param contributionAmount Unrounded amount charged for the item
 */
public record ItemContribution(
        String itemId,
        String itemName,
        BigDecimal quantity,
        BigDecimal unitPrice,
        BigDecimal assignedShare,
        BigDecimal contributionAmount
) {
}
