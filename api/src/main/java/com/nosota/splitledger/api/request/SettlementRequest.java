package com.nosota.splitledger.api.request;

import com.nosota.splitledger.api.dto.Category;
import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.model.TransferStrategyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;

/**
 * Input of a settlement computation for one trip.
 *
 * @param tripId       Trip
 * @param baseCurrency Currency every expense is expected in
 * @param participants Trip participants in listing order; people without expenses still get a summary
 * @param expenses     All expenses of the trip
 * @param categories   Category metadata; null skips the category spending output
 * @param strategy     Transfer strategy; null uses the configured default
 */
@Builder
public record SettlementRequest(
        @NotBlank
        String tripId,
        @NotBlank
        String baseCurrency,
        List<String> participants,
        @NotNull
        List<@Valid Expense> expenses,
        List<Category> categories,
        TransferStrategyType strategy
) {
    public SettlementRequest {
        participants = participants == null ? List.of() : List.copyOf(participants);
        expenses = expenses == null ? List.of() : List.copyOf(expenses);
        categories = categories == null ? null : List.copyOf(categories);
    }
}
