package com.nosota.splitledger.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * One receipt line.
 *
 * @param id                 Item identifier, unique within the receipt
 * @param name               Display name
 * @param quantity           Quantity, may be fractional (e.g. 0.5 kg)
 * @param unitPrice          Price per unit
 * @param taxable            Whether the item counts towards a {@code TAXABLE_ITEMS_ONLY} base
 * @param serviceChargeable  Whether a service charge applies to the item (informational)
 * @param assignment         Participants sharing the item; null or empty leaves the item unassigned
 */
@Builder
public record LineItem(
        @NotNull
        String id,
        String name,
        @NotNull
        BigDecimal quantity,
        @NotNull
        BigDecimal unitPrice,
        boolean taxable,
        boolean serviceChargeable,
        ItemAssignment assignment
) {
    public BigDecimal itemTotal() {
        return quantity.multiply(unitPrice);
    }
}
