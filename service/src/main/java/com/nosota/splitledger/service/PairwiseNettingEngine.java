package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.dto.PairwiseDebt;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses the debts created by a list of expenses into at most one debt per pair of people.
 *
 * <p>Every participant other than the payer owes the payer their share. Debts in both
 * directions between two people are netted; a net below the currency's smallest unit means
 * the pair is settled.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PairwiseNettingEngine {

    private final ExpenseShareResolver shareResolver;

    /**
     * Directed debt key: {@code debtorId} owes {@code creditorId}.
     */
    public record DebtDirection(String debtorId, String creditorId) {
        public DebtDirection reversed() {
            return new DebtDirection(creditorId, debtorId);
        }
    }

    /**
     * Sums raw debts per direction, in order of first occurrence.
     */
    public Map<DebtDirection, BigDecimal> accumulateDebts(@NotNull List<Expense> expenses) {
        Map<DebtDirection, BigDecimal> debts = new LinkedHashMap<>();
        for (Expense expense : expenses) {
            Map<String, BigDecimal> shares = shareResolver.resolveShares(expense);
            String payerId = expense.payerUserId();
            shares.forEach((participantId, share) -> {
                if (!participantId.equals(payerId)) {
                    debts.merge(new DebtDirection(participantId, payerId), share, BigDecimal::add);
                }
            });
        }
        return debts;
    }

    /**
     * Nets the debts of {@code expenses} pair by pair.
     *
     * @param expenses     Expenses to net, all in {@code currency}
     * @param currency     Currency whose smallest unit is the settled threshold
     * @param computedAt   Timestamp stamped on every debt
     * @return One positive debt per unsettled pair, in order of first encounter of the pair
     */
    public List<PairwiseDebt> netDebts(@NotNull List<Expense> expenses,
                                       @NotNull String currency,
                                       @NotNull LocalDateTime computedAt) {
        Map<DebtDirection, BigDecimal> debts = accumulateDebts(expenses);
        BigDecimal epsilon = CurrencyPrecision.smallestUnit(currency);

        List<PairwiseDebt> result = new ArrayList<>();
        Set<DebtDirection> processed = new HashSet<>();
        for (DebtDirection direction : debts.keySet()) {
            if (processed.contains(direction)) {
                continue;
            }
            processed.add(direction);
            processed.add(direction.reversed());

            BigDecimal owed = debts.get(direction);
            BigDecimal owedBack = debts.getOrDefault(direction.reversed(), BigDecimal.ZERO);
            BigDecimal net = owed.subtract(owedBack);

            log.debug("Netting {} <-> {}: {} vs {} = {}", direction.debtorId(), direction.creditorId(),
                    owed.toPlainString(), owedBack.toPlainString(), net.toPlainString());

            if (net.abs().compareTo(epsilon) < 0) {
                continue;
            }
            if (net.signum() > 0) {
                result.add(new PairwiseDebt(direction.debtorId(), direction.creditorId(), net, computedAt));
            } else {
                result.add(new PairwiseDebt(direction.creditorId(), direction.debtorId(), net.negate(), computedAt));
            }
        }

        log.info("Pairwise netting: expenses={}, directedDebts={}, nettedDebts={}",
                expenses.size(), debts.size(), result.size());
        return result;
    }
}
