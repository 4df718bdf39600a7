package com.nosota.splitledger.api.dto;

import com.nosota.splitledger.api.model.ExtraType;
import com.nosota.splitledger.api.model.PercentBase;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Tax, tip, fee or discount attached to a receipt.
 *
 * <p>A {@code PERCENT} extra is {@code value}% of its base; when {@code base} is null the
 * allocation rule's default percent base is used. An {@code ABSOLUTE} extra is a flat
 * amount and must not carry a base.
 *
 * @param id    Identifier, required for fees and discounts
 * @param name  Display name, required for fees and discounts
 * @param type  PERCENT or ABSOLUTE
 * @param value Percentage (e.g. 10 for 10%) or flat amount
 * @param base  Percent base override, null for ABSOLUTE extras
 */
public record Extra(
        String id,
        String name,
        @NotNull
        ExtraType type,
        @NotNull
        BigDecimal value,
        PercentBase base
) {
    public static Extra percent(BigDecimal value, PercentBase base) {
        return new Extra(null, null, ExtraType.PERCENT, value, base);
    }

    public static Extra absolute(BigDecimal value) {
        return new Extra(null, null, ExtraType.ABSOLUTE, value, null);
    }

    public static Extra percent(String id, String name, BigDecimal value, PercentBase base) {
        return new Extra(id, name, ExtraType.PERCENT, value, base);
    }

    public static Extra absolute(String id, String name, BigDecimal value) {
        return new Extra(id, name, ExtraType.ABSOLUTE, value, null);
    }

    /**
     * Key used in breakdowns: the name, falling back to the id.
     */
    public String label() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return id;
    }
}
