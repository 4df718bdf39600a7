package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Person totals with the person's share of spending per category, largest first.
 */
public record PersonCategorySpending(
        String userId,
        BigDecimal totalPaidBase,
        BigDecimal totalOwedBase,
        BigDecimal netBase,
        List<CategorySpending> categoryBreakdown
) {
    public PersonCategorySpending {
        categoryBreakdown = categoryBreakdown == null ? List.of() : List.copyOf(categoryBreakdown);
    }

    public BigDecimal spendingFor(String categoryId) {
        return categoryBreakdown.stream()
                .filter(c -> c.categoryId().equals(categoryId))
                .map(CategorySpending::amount)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }
}
