package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.dto.ExpenseContribution;
import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.TransferBreakdown;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Explains a transfer between two people expense by expense.
 *
 * <p>The direct contribution of an expense to the debt of {@code from} towards {@code to} is
 * what {@code from} owes when {@code to} paid, minus what {@code to} owes when {@code from}
 * paid, and zero when someone else paid.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class TransferBreakdownCalculator {

    private final ExpenseShareResolver shareResolver;

    public TransferBreakdown calculateBreakdown(@NotNull MinimalTransfer transfer, @NotNull List<Expense> expenses) {
        return calculateBreakdown(transfer.fromUserId(), transfer.toUserId(), transfer.amountBase(), expenses);
    }

    /**
     * @param fromUserId     Sender of the transfer
     * @param toUserId       Receiver of the transfer
     * @param transferAmount Amount of the transfer
     * @param expenses       Trip expenses; those whose shares cannot be resolved are left out
     */
    public TransferBreakdown calculateBreakdown(@NotBlank String fromUserId,
                                                @NotBlank String toUserId,
                                                @NotNull BigDecimal transferAmount,
                                                @NotNull List<Expense> expenses) {
        List<ExpenseContribution> contributions = new ArrayList<>();
        for (Expense expense : expenses) {
            if (!shareResolver.check(expense).isEmpty()) {
                log.debug("Expense {} left out of the breakdown {} -> {}", expense.id(), fromUserId, toUserId);
                continue;
            }
            Map<String, BigDecimal> shares = shareResolver.resolveShares(expense);

            String payer = expense.payerUserId();
            BigDecimal fromPaid = payer.equals(fromUserId) ? expense.amount() : BigDecimal.ZERO;
            BigDecimal toPaid = payer.equals(toUserId) ? expense.amount() : BigDecimal.ZERO;
            BigDecimal fromOwes = shares.getOrDefault(fromUserId, BigDecimal.ZERO);
            BigDecimal toOwes = shares.getOrDefault(toUserId, BigDecimal.ZERO);

            BigDecimal net;
            if (payer.equals(toUserId)) {
                net = fromOwes;
            } else if (payer.equals(fromUserId)) {
                net = toOwes.negate();
            } else {
                net = BigDecimal.ZERO;
            }

            contributions.add(new ExpenseContribution(expense.id(), expense.description(), fromPaid, fromOwes,
                    toPaid, toOwes, net));
        }

        TransferBreakdown breakdown = new TransferBreakdown(fromUserId, toUserId, transferAmount, contributions);
        log.debug("Breakdown {} -> {}: {} relevant of {} expenses, net {}", fromUserId, toUserId,
                breakdown.relevantContributions().size(), expenses.size(),
                breakdown.netOfContributions().toPlainString());
        return breakdown;
    }
}
