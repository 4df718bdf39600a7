package com.nosota.splitledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Expense record consumed read-only by the settlement engine.
 *
 * @param id          Expense id
 * @param tripId      Trip the expense belongs to
 * @param payerUserId Participant who paid
 * @param currency    ISO 4217 code of {@code amount}
 * @param amount      Total paid
 * @param split       Split type with its type-specific data
 * @param categoryId  Category for spending breakdowns, null for uncategorized
 * @param description Free text
 */
@Builder
public record Expense(
        @NotBlank
        String id,
        String tripId,
        @NotBlank
        String payerUserId,
        @NotBlank
        String currency,
        @NotNull
        @Positive
        BigDecimal amount,
        @NotNull
        ExpenseSplit split,
        String categoryId,
        String description
) {
}
