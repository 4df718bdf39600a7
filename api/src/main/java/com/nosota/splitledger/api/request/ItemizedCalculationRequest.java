package com.nosota.splitledger.api.request;

import com.nosota.splitledger.api.dto.AllocationRule;
import com.nosota.splitledger.api.dto.Extras;
import com.nosota.splitledger.api.dto.LineItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;

/**
 * Input of an itemized calculation.
 *
 * @param items        Receipt lines in receipt order
 * @param extras       Tax, tip, fees and discounts; null means none
 * @param allocation   Percent base, absolute split mode and rounding
 * @param participants Participants in listing order; the order drives FIRST_LISTED and tie-breaks
 * @param payerId      Payer of the expense
 * @param currency     ISO 4217 code
 */
@Builder
public record ItemizedCalculationRequest(
        @NotNull
        List<@Valid LineItem> items,
        @Valid
        Extras extras,
        @NotNull
        @Valid
        AllocationRule allocation,
        @NotNull
        List<String> participants,
        @NotBlank
        String payerId,
        @NotBlank
        String currency
) {
    public ItemizedCalculationRequest {
        items = items == null ? List.of() : List.copyOf(items);
        extras = extras == null ? Extras.none() : extras;
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
