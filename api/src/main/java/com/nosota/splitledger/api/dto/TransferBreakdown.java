package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Expense-by-expense explanation of a transfer.
 */
public record TransferBreakdown(
        String fromUserId,
        String toUserId,
        BigDecimal totalAmount,
        List<ExpenseContribution> contributions
) {
    public TransferBreakdown {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    /**
     * Contributions that actually move the transfer amount.
     */
    public List<ExpenseContribution> relevantContributions() {
        return contributions.stream()
                .filter(c -> c.netContribution().signum() != 0)
                .toList();
    }

    public BigDecimal netOfContributions() {
        return contributions.stream()
                .map(ExpenseContribution::netContribution)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
