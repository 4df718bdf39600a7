package com.nosota.splitledger.api.dto;

import jakarta.validation.Valid;
import lombok.Builder;

import java.util.List;

/**
 * All extras of a receipt. Tax and tip are optional; fees and discounts may be empty.
 */
@Builder
public record Extras(
        @Valid
        Extra tax,
        @Valid
        Extra tip,
        List<@Valid Extra> fees,
        List<@Valid Extra> discounts
) {
    public Extras {
        fees = fees == null ? List.of() : List.copyOf(fees);
        discounts = discounts == null ? List.of() : List.copyOf(discounts);
    }

    public static Extras none() {
        return new Extras(null, null, List.of(), List.of());
    }
}
