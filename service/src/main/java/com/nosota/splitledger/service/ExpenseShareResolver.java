package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.dto.ExpenseSplit;
import com.nosota.splitledger.api.dto.RoundingConfig;
import com.nosota.splitledger.api.dto.ValidationError;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import com.nosota.splitledger.api.model.RemainderPolicy;
import com.nosota.splitledger.api.model.RoundingMode;
import com.nosota.splitledger.api.model.ValidationErrorCode;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an expense into what each participant owes for it.
 *
 * <p>Equal and weighted splits are rounded to the currency's smallest unit with
 * {@code ROUND_HALF_UP}; the remainder goes to the largest raw share, ties to the first listed,
 * so the shares always sum to the expense amount. Itemized expenses carry their computed
 * {@code participantAmounts}, which are returned untouched.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ExpenseShareResolver {

    private final RoundingService roundingService;

    /**
     * Checks that an expense can be resolved and that its shares add up to its amount.
     *
     * @return Blocking errors; empty when {@link #resolveShares(Expense)} is safe to call
     */
    public List<ValidationError> check(@NotNull Expense expense) {
        List<ValidationError> errors = new ArrayList<>();
        ExpenseSplit split = expense.split();

        if (split instanceof ExpenseSplit.Equal equal) {
            if (equal.participants().isEmpty()) {
                errors.add(invalidSplit(expense, "has no participants"));
            } else if (new HashSet<>(equal.participants()).size() != equal.participants().size()) {
                errors.add(invalidSplit(expense, "lists a participant more than once"));
            }
        } else if (split instanceof ExpenseSplit.Weighted weighted) {
            if (weighted.weights().isEmpty()) {
                errors.add(invalidSplit(expense, "has no participants"));
            } else if (weighted.weights().values().stream().anyMatch(w -> w == null || w.signum() < 0)) {
                errors.add(invalidSplit(expense, "has a missing or negative weight"));
            } else if (MoneyMath.sum(weighted.weights().values()).signum() == 0) {
                errors.add(invalidSplit(expense, "has weights summing to zero"));
            }
        } else if (split instanceof ExpenseSplit.Itemized itemized) {
            if (itemized.participantAmounts().isEmpty()) {
                errors.add(invalidSplit(expense, "has no computed participant amounts"));
            } else {
                BigDecimal sum = MoneyMath.sum(itemized.participantAmounts().values());
                BigDecimal epsilon = CurrencyPrecision.smallestUnit(expense.currency());
                if (sum.subtract(expense.amount()).abs().compareTo(epsilon) >= 0) {
                    errors.add(ValidationError.blocking(ValidationErrorCode.COMPUTATION_MISMATCH, expense.id(),
                            String.format("Expense %s participant amounts sum to %s, expected %s",
                                    expense.id(), sum.toPlainString(), expense.amount().toPlainString())));
                }
            }
        }
        return errors;
    }

    /**
     * Resolves each participant's share of {@code expense}, in participant order.
     *
     * @throws IllegalArgumentException if the split cannot be resolved, see {@link #check(Expense)}
     */
    public Map<String, BigDecimal> resolveShares(@NotNull Expense expense) {
        List<ValidationError> errors = check(expense);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(errors.get(0).message());
        }

        ExpenseSplit split = expense.split();
        if (split instanceof ExpenseSplit.Itemized itemized) {
            return new LinkedHashMap<>(itemized.participantAmounts());
        }

        Map<String, BigDecimal> raw = new LinkedHashMap<>();
        if (split instanceof ExpenseSplit.Equal equal) {
            BigDecimal each = MoneyMath.divide(expense.amount(), equal.participants().size());
            equal.participants().forEach(userId -> raw.put(userId, each));
        } else if (split instanceof ExpenseSplit.Weighted weighted) {
            BigDecimal totalWeight = MoneyMath.sum(weighted.weights().values());
            weighted.weights().forEach((userId, weight) ->
                    raw.put(userId, MoneyMath.divide(expense.amount().multiply(weight), totalWeight)));
        }

        RoundingConfig rounding = RoundingConfig.of(CurrencyPrecision.smallestUnit(expense.currency()),
                RoundingMode.ROUND_HALF_UP, RemainderPolicy.LARGEST_SHARE);
        Map<String, BigDecimal> shares = roundingService.roundAmounts(raw, expense.amount(), rounding, null);

        log.debug("Expense {} ({}) shares: {}", expense.id(), split.getClass().getSimpleName(), shares);
        return shares;
    }

    private ValidationError invalidSplit(Expense expense, String problem) {
        return ValidationError.blocking(ValidationErrorCode.INVALID_ASSIGNMENT, expense.id(),
                String.format("Expense %s %s", expense.id(), problem));
    }
}
