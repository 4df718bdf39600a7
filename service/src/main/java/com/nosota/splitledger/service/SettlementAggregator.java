package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.Category;
import com.nosota.splitledger.api.dto.CategorySpending;
import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.PairwiseDebt;
import com.nosota.splitledger.api.dto.PersonCategorySpending;
import com.nosota.splitledger.api.dto.PersonSummary;
import com.nosota.splitledger.api.dto.ValidationError;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import com.nosota.splitledger.api.model.TransferStrategyType;
import com.nosota.splitledger.api.model.ValidationErrorCode;
import com.nosota.splitledger.api.request.SettlementRequest;
import com.nosota.splitledger.api.response.SettlementResult;
import com.nosota.splitledger.error.BalanceConservationException;
import com.nosota.splitledger.service.transfer.SettlementContext;
import com.nosota.splitledger.service.transfer.TransferStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Settles a trip: balances per person, netted pairwise debts, transfers and spending per category.
 *
 * <p>Expenses are walked once; paid and owed totals and category buckets are collected by a
 * {@link SettlementAccumulator} that is finalized after the walk. The sum of all net balances
 * must be zero within the base currency's smallest unit; a violation is reported as a blocking
 * {@link ValidationErrorCode#BALANCE_CONSERVATION_VIOLATION}.
 *
 * <p>Expenses in another currency than the trip's base currency are rejected with
 * {@link ValidationErrorCode#CURRENCY_MISMATCH} and left out of every total.
 */
@Service
@Validated
@Slf4j
public class SettlementAggregator {

    public static final String UNCATEGORIZED = "uncategorized";

    private final ExpenseShareResolver shareResolver;
    private final PairwiseNettingEngine nettingEngine;
    private final SettlementValidator settlementValidator;
    private final Map<TransferStrategyType, TransferStrategy> strategies;
    private final Clock clock;
    private final TransferStrategyType defaultStrategy;

    public SettlementAggregator(ExpenseShareResolver shareResolver,
                                PairwiseNettingEngine nettingEngine,
                                SettlementValidator settlementValidator,
                                List<TransferStrategy> strategies,
                                Clock clock,
                                @Value("${split-ledger.settlement.default-strategy:PAIRWISE_NET}")
                                TransferStrategyType defaultStrategy) {
        this.shareResolver = shareResolver;
        this.nettingEngine = nettingEngine;
        this.settlementValidator = settlementValidator;
        this.strategies = new EnumMap<>(TransferStrategyType.class);
        for (TransferStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        this.clock = clock;
        this.defaultStrategy = defaultStrategy;
    }

    /**
     * Computes the full settlement of a trip.
     *
     * @param request Trip, base currency, participants, expenses, optional categories and strategy
     * @return Summaries, debts, transfers, category spending and errors; untrusted when any error is blocking
     * @throws IllegalStateException if no strategy bean handles the requested strategy
     */
    public SettlementResult settle(@NotNull @Valid SettlementRequest request) {
        LocalDateTime computedAt = LocalDateTime.now(clock);
        String currency = request.baseCurrency();
        List<ValidationError> errors = new ArrayList<>();

        List<Expense> accepted = acceptExpenses(request.expenses(), currency, errors);
        SettlementAccumulator accumulator = accumulate(accepted, request.participants());

        Map<String, PersonSummary> summaries = accumulator.personSummaries();
        if (!validateBalances(summaries, currency)) {
            BigDecimal sum = netSum(summaries);
            log.error("Balance conservation violated for trip {}: net balances sum to {}",
                    request.tripId(), sum.toPlainString());
            errors.add(ValidationError.blocking(ValidationErrorCode.BALANCE_CONSERVATION_VIOLATION, request.tripId(),
                    String.format("Net balances of trip %s sum to %s instead of zero",
                            request.tripId(), sum.toPlainString())));
        }

        List<PairwiseDebt> pairwiseDebts = nettingEngine.netDebts(accepted, currency, computedAt);

        TransferStrategyType strategyType = request.strategy() != null ? request.strategy() : defaultStrategy;
        TransferStrategy strategy = strategies.get(strategyType);
        if (strategy == null) {
            throw new IllegalStateException(String.format("No transfer strategy registered for %s", strategyType));
        }
        SettlementContext context = new SettlementContext(request.tripId(), currency, summaries, pairwiseDebts,
                computedAt);
        List<MinimalTransfer> transfers = strategy.computeTransfers(context);

        errors.addAll(settlementValidator.validate(transfers, summaries, currency));

        Map<String, PersonCategorySpending> categorySpending = request.categories() == null
                ? Map.of()
                : accumulator.categorySpending(request.categories());

        log.info("Settlement for trip {}: expenses={}, accepted={}, people={}, debts={}, transfers={}, strategy={}, errors={}",
                request.tripId(), request.expenses().size(), accepted.size(), summaries.size(),
                pairwiseDebts.size(), transfers.size(), strategyType, errors.size());

        return new SettlementResult(request.tripId(), currency, summaries, pairwiseDebts, transfers, strategyType,
                categorySpending, errors, computedAt);
    }

    /**
     * @return true when the net balances sum to zero within the smallest unit of {@code currency}
     */
    public boolean validateBalances(@NotNull Map<String, PersonSummary> personSummaries, @NotNull String currency) {
        return netSum(personSummaries).abs().compareTo(CurrencyPrecision.smallestUnit(currency)) < 0;
    }

    /**
     * Turns an untrusted settlement into an exception, for callers that prefer one.
     *
     * @throws BalanceConservationException if the result carries a conservation violation
     */
    public void requireBalanced(@NotNull SettlementResult result) throws BalanceConservationException {
        List<ValidationError> violations = result.blockingErrors().stream()
                .filter(e -> e.code() == ValidationErrorCode.BALANCE_CONSERVATION_VIOLATION)
                .toList();
        if (!violations.isEmpty()) {
            throw new BalanceConservationException(violations.get(0).message());
        }
    }

    private List<Expense> acceptExpenses(List<Expense> expenses, String currency, List<ValidationError> errors) {
        List<Expense> accepted = new ArrayList<>();
        for (Expense expense : expenses) {
            if (!expense.currency().equalsIgnoreCase(currency)) {
                log.warn("Expense {} is in {} but the trip settles in {}; skipped",
                        expense.id(), expense.currency(), currency);
                errors.add(ValidationError.blocking(ValidationErrorCode.CURRENCY_MISMATCH, expense.id(),
                        String.format("Expense %s is in %s, expected %s", expense.id(), expense.currency(), currency)));
                continue;
            }

            List<ValidationError> problems = shareResolver.check(expense);
            if (!problems.isEmpty()) {
                log.warn("Expense {} cannot be settled: {}", expense.id(), problems.get(0).message());
                errors.addAll(problems);
                continue;
            }
            accepted.add(expense);
        }
        return accepted;
    }

    private SettlementAccumulator accumulate(List<Expense> expenses, List<String> participants) {
        SettlementAccumulator accumulator = new SettlementAccumulator(participants == null ? List.of() : participants);
        for (Expense expense : expenses) {
            Map<String, BigDecimal> shares = shareResolver.resolveShares(expense);
            accumulator.add(expense, shares);
            log.debug("Expense {} paid by {}: {} -> {}", expense.id(), expense.payerUserId(),
                    expense.amount().toPlainString(), shares);
        }
        return accumulator;
    }

    private static BigDecimal netSum(Map<String, PersonSummary> personSummaries) {
        return personSummaries.values().stream()
                .map(PersonSummary::netBase)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Single-pass collector of paid, owed and per-category amounts. Results are built from it
     * only once the walk over the expenses is complete.
     */
    private static class SettlementAccumulator {
        private final Map<String, BigDecimal> paid = new LinkedHashMap<>();
        private final Map<String, BigDecimal> owed = new LinkedHashMap<>();
        private final Map<String, Map<String, BigDecimal>> owedByCategory = new LinkedHashMap<>();

        SettlementAccumulator(List<String> participants) {
            participants.forEach(this::register);
        }

        void add(Expense expense, Map<String, BigDecimal> shares) {
            register(expense.payerUserId());
            paid.merge(expense.payerUserId(), expense.amount(), BigDecimal::add);

            String categoryId = expense.categoryId() != null ? expense.categoryId() : UNCATEGORIZED;
            shares.forEach((userId, share) -> {
                register(userId);
                owed.merge(userId, share, BigDecimal::add);
                owedByCategory.get(userId).merge(categoryId, share, BigDecimal::add);
            });
        }

        private void register(String userId) {
            paid.putIfAbsent(userId, BigDecimal.ZERO);
            owed.putIfAbsent(userId, BigDecimal.ZERO);
            owedByCategory.putIfAbsent(userId, new LinkedHashMap<>());
        }

        Map<String, PersonSummary> personSummaries() {
            Map<String, PersonSummary> summaries = new LinkedHashMap<>();
            paid.forEach((userId, totalPaid) -> {
                BigDecimal totalOwed = owed.get(userId);
                summaries.put(userId, new PersonSummary(userId, totalPaid, totalOwed, totalPaid.subtract(totalOwed)));
            });
            return summaries;
        }

        Map<String, PersonCategorySpending> categorySpending(List<Category> categories) {
            Map<String, Category> byId = categories.stream()
                    .collect(Collectors.toMap(Category::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));

            Map<String, PersonCategorySpending> result = new LinkedHashMap<>();
            personSummaries().forEach((userId, summary) -> {
                List<CategorySpending> breakdown = owedByCategory.get(userId).entrySet().stream()
                        .map(e -> toSpending(e.getKey(), e.getValue(), byId.get(e.getKey())))
                        .sorted(Comparator.comparing(CategorySpending::amount).reversed()
                                .thenComparing(CategorySpending::categoryId))
                        .toList();
                result.put(userId, new PersonCategorySpending(userId, summary.totalPaidBase(),
                        summary.totalOwedBase(), summary.netBase(), breakdown));
            });
            return result;
        }

        private static CategorySpending toSpending(String categoryId, BigDecimal amount, Category category) {
            if (category == null) {
                String name = UNCATEGORIZED.equals(categoryId) ? "Uncategorized" : categoryId;
                return new CategorySpending(categoryId, name, amount, null, null);
            }
            return new CategorySpending(categoryId, category.name(), amount, category.color(), category.icon());
        }
    }
}
