package com.nosota.splitledger.tests;

import com.nosota.splitledger.TestBase;
import com.nosota.splitledger.api.dto.Category;
import com.nosota.splitledger.api.dto.CategorySpending;
import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.dto.ExpenseSplit;
import com.nosota.splitledger.api.dto.Extra;
import com.nosota.splitledger.api.dto.Extras;
import com.nosota.splitledger.api.dto.ItemAssignment;
import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.PersonCategorySpending;
import com.nosota.splitledger.api.dto.PersonSummary;
import com.nosota.splitledger.api.dto.ValidationError;
import com.nosota.splitledger.api.model.PercentBase;
import com.nosota.splitledger.api.model.RemainderPolicy;
import com.nosota.splitledger.api.model.RoundingMode;
import com.nosota.splitledger.api.model.TransferStrategyType;
import com.nosota.splitledger.api.model.ValidationErrorCode;
import com.nosota.splitledger.api.request.ItemizedCalculationRequest;
import com.nosota.splitledger.api.request.SettlementRequest;
import com.nosota.splitledger.api.response.ItemizedCalculationResult;
import com.nosota.splitledger.api.response.SettlementResult;
import com.nosota.splitledger.error.BalanceConservationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Whole-trip settlement: balances, transfers, categories and the checks on top of them.
 */
@DisplayName("7. Settlement Aggregator Tests")
public class SettlementAggregatorTest extends TestBase {

    private static final List<Category> CATEGORIES = List.of(
            new Category("food", "Food", "#ff9800", "restaurant"),
            new Category("transport", "Transport", "#2196f3", "directions_car"));

    @Test
    @DisplayName("AGG-001: Two people, one dinner")
    void testTwoPersonSettlement() {
        // Arrange
        SettlementRequest request = request(List.of("alice", "bob"),
                List.of(equalExpense("alice", "100.00", "alice", "bob")));

        // Act
        SettlementResult result = settlementAggregator.settle(request);

        // Assert
        assertThat(result.isTrusted()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.computedAt()).isEqualTo(TestClockConfig.FIXED_TIME);
        assertThat(result.strategy()).isEqualTo(TransferStrategyType.PAIRWISE_NET);

        PersonSummary alice = result.personSummaries().get("alice");
        assertThat(alice.totalPaidBase()).isEqualByComparingTo("100.00");
        assertThat(alice.totalOwedBase()).isEqualByComparingTo("50.00");
        assertThat(alice.netBase()).isEqualByComparingTo("50.00");
        assertThat(result.personSummaries().get("bob").netBase()).isEqualByComparingTo("-50.00");

        assertThat(result.transfers()).singleElement().satisfies(t -> {
            assertThat(t.fromUserId()).isEqualTo("bob");
            assertThat(t.toUserId()).isEqualTo("alice");
            assertThat(t.amountBase()).isEqualByComparingTo("50.00");
            assertThat(t.tripId()).isEqualTo(TRIP);
        });
    }

    @Test
    @DisplayName("AGG-002: Mixed split types keep the trip balanced")
    void testMixedSplitsConservation() {
        // Arrange
        List<Expense> expenses = List.of(
                equalExpense("alice", "100.00", "alice", "bob", "carol"),
                weightedExpense("bob", "90.00", amounts("alice", "2", "carol", "1")),
                itemizedExpense("carol", "26.40", amounts("alice", "13.20", "bob", "13.20")));
        SettlementRequest request = SettlementRequest.builder()
                .tripId(TRIP)
                .baseCurrency(USD)
                .participants(List.of("alice", "bob", "carol"))
                .expenses(expenses)
                .strategy(TransferStrategyType.GREEDY_MINIMAL)
                .build();

        // Act
        SettlementResult result = settlementAggregator.settle(request);

        // Assert
        assertThat(result.isTrusted()).isTrue();
        assertThat(result.strategy()).isEqualTo(TransferStrategyType.GREEDY_MINIMAL);
        assertThat(settlementAggregator.validateBalances(result.personSummaries(), USD)).isTrue();
        assertThat(result.personSummaries().values().stream()
                .map(PersonSummary::netBase)
                .reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo("0");

        assertThat(result.personSummaries().get("alice").netBase()).isEqualByComparingTo("-6.54");
        assertThat(result.personSummaries().get("bob").netBase()).isEqualByComparingTo("43.47");
        assertThat(result.personSummaries().get("carol").netBase()).isEqualByComparingTo("-36.93");

        assertThat(result.transfers()).extracting(MinimalTransfer::fromUserId, MinimalTransfer::toUserId)
                .containsExactly(tuple("carol", "bob"), tuple("alice", "bob"));
        assertThat(result.transfers().get(0).amountBase()).isEqualByComparingTo("36.93");
        assertThat(result.transfers().get(1).amountBase()).isEqualByComparingTo("6.54");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("AGG-003: Participants without expenses get zero balances")
    void testIdleParticipant() {
        SettlementResult result = settlementAggregator.settle(request(List.of("alice", "bob", "dave"),
                List.of(equalExpense("alice", "40.00", "alice", "bob"))));

        assertThat(result.personSummaries()).containsOnlyKeys("alice", "bob", "dave");
        assertThat(result.personSummaries().keySet()).containsExactly("alice", "bob", "dave");
        PersonSummary dave = result.personSummaries().get("dave");
        assertThat(dave.totalPaidBase()).isEqualByComparingTo("0");
        assertThat(dave.totalOwedBase()).isEqualByComparingTo("0");
        assertThat(dave.netBase()).isEqualByComparingTo("0");

        SettlementResult withoutRoster = settlementAggregator.settle(request(null,
                List.of(equalExpense("bob", "40.00", "alice", "bob"))));
        assertThat(withoutRoster.personSummaries().keySet()).containsExactly("bob", "alice");
    }

    @Test
    @DisplayName("AGG-004: Expense in another currency is reported and left out")
    void testCurrencyMismatch() {
        // Arrange
        Expense euros = Expense.builder()
                .id("eur-1")
                .tripId(TRIP)
                .payerUserId("bob")
                .currency("EUR")
                .amount(money("80.00"))
                .split(new ExpenseSplit.Equal(List.of("alice", "bob")))
                .build();
        SettlementRequest request = request(List.of("alice", "bob"),
                List.of(equalExpense("alice", "100.00", "alice", "bob"), euros));

        // Act
        SettlementResult result = settlementAggregator.settle(request);

        // Assert
        assertThat(result.isTrusted()).isFalse();
        assertThat(result.blockingErrors()).extracting(ValidationError::code, ValidationError::subjectId)
                .containsExactly(tuple(ValidationErrorCode.CURRENCY_MISMATCH, "eur-1"));
        assertThat(result.personSummaries().get("bob").totalPaidBase()).isEqualByComparingTo("0");
        assertThat(result.transfers()).singleElement()
                .satisfies(t -> assertThat(t.amountBase()).isEqualByComparingTo("50.00"));
    }

    @Test
    @DisplayName("AGG-005: Broken expense is reported and the rest still settles")
    void testBrokenExpenseSkipped() {
        SettlementResult result = settlementAggregator.settle(request(List.of("alice", "bob"), List.of(
                equalExpense("alice", "100.00", "alice", "bob"),
                itemizedExpense("bob", "30.00", amounts("alice", "10.00", "bob", "10.00")))));

        assertThat(result.isTrusted()).isFalse();
        assertThat(result.blockingErrors()).extracting(ValidationError::code)
                .containsExactly(ValidationErrorCode.COMPUTATION_MISMATCH);
        assertThat(settlementAggregator.validateBalances(result.personSummaries(), USD)).isTrue();
        assertThat(result.personSummaries().get("bob").netBase()).isEqualByComparingTo("-50.00");
    }

    @Test
    @DisplayName("AGG-006: Spending per category, largest first")
    void testCategorySpending() {
        // Arrange
        List<Expense> expenses = List.of(
                expense("alice", "60.00", new ExpenseSplit.Equal(List.of("alice", "bob")), "food"),
                expense("bob", "20.00", new ExpenseSplit.Equal(List.of("alice", "bob")), "transport"),
                equalExpense("alice", "10.00", "alice", "bob"),
                expense("bob", "4.00", new ExpenseSplit.Equal(List.of("alice")), "misc"));
        SettlementRequest request = SettlementRequest.builder()
                .tripId(TRIP)
                .baseCurrency(USD)
                .participants(List.of("alice", "bob"))
                .expenses(expenses)
                .categories(CATEGORIES)
                .build();

        // Act
        SettlementResult result = settlementAggregator.settle(request);

        // Assert
        PersonCategorySpending alice = result.categorySpending().get("alice");
        assertThat(alice.totalPaidBase()).isEqualByComparingTo("70.00");
        assertThat(alice.totalOwedBase()).isEqualByComparingTo("49.00");
        assertThat(alice.categoryBreakdown()).extracting(CategorySpending::categoryId, CategorySpending::categoryName)
                .containsExactly(
                        tuple("food", "Food"),
                        tuple("transport", "Transport"),
                        tuple("uncategorized", "Uncategorized"),
                        tuple("misc", "misc"));
        assertThat(alice.categoryBreakdown().get(0).color()).isEqualTo("#ff9800");
        assertThat(alice.spendingFor("food")).isEqualByComparingTo("30.00");
        assertThat(alice.spendingFor("misc")).isEqualByComparingTo("4.00");
        assertThat(alice.spendingFor("lodging")).isEqualByComparingTo("0");

        PersonCategorySpending bob = result.categorySpending().get("bob");
        assertThat(bob.categoryBreakdown()).extracting(CategorySpending::categoryId)
                .containsExactly("food", "transport", "uncategorized");
    }

    @Test
    @DisplayName("AGG-007: No category metadata means no category output")
    void testNoCategories() {
        SettlementResult result = settlementAggregator.settle(request(List.of("alice", "bob"),
                List.of(expense("alice", "60.00", new ExpenseSplit.Equal(List.of("alice", "bob")), "food"))));

        assertThat(result.categorySpending()).isEmpty();

        SettlementResult unnamed = settlementAggregator.settle(SettlementRequest.builder()
                .tripId(TRIP)
                .baseCurrency(USD)
                .participants(List.of("alice", "bob"))
                .expenses(List.of(expense("alice", "60.00", new ExpenseSplit.Equal(List.of("alice", "bob")), "food")))
                .categories(List.of())
                .build());
        Map<String, PersonCategorySpending> spending = unnamed.categorySpending();
        assertThat(spending.get("bob").categoryBreakdown()).extracting(CategorySpending::categoryName)
                .containsExactly("food");
    }

    @Test
    @DisplayName("AGG-008: Balance check and its exception form")
    void testBalanceConservation() {
        // Arrange
        Map<String, PersonSummary> unbalanced = Map.of(
                "alice", new PersonSummary("alice", money("20.00"), money("10.00"), money("10.00")),
                "bob", new PersonSummary("bob", money("0"), money("9.99"), money("-9.99")));
        SettlementResult violated = new SettlementResult(TRIP, USD, unbalanced, List.of(), List.of(),
                TransferStrategyType.PAIRWISE_NET, Map.of(),
                List.of(ValidationError.blocking(ValidationErrorCode.BALANCE_CONSERVATION_VIOLATION, TRIP,
                        "Net balances of trip trip-1 sum to 0.01 instead of zero")),
                TestClockConfig.FIXED_TIME);
        SettlementResult balanced = settlementAggregator.settle(request(List.of("alice", "bob"),
                List.of(equalExpense("alice", "100.00", "alice", "bob"))));

        // Act & Assert
        assertThat(settlementAggregator.validateBalances(unbalanced, USD)).isFalse();
        assertThat(settlementAggregator.validateBalances(balanced.personSummaries(), USD)).isTrue();
        assertThatThrownBy(() -> settlementAggregator.requireBalanced(violated))
                .isInstanceOf(BalanceConservationException.class)
                .hasMessageContaining("0.01");
        assertThatCode(() -> settlementAggregator.requireBalanced(balanced)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("AGG-009: Same input, same settlement")
    void testIdempotentSettlement() {
        SettlementRequest request = request(List.of("alice", "bob", "carol"), List.of(
                equalExpense("alice", "100.00", "alice", "bob", "carol"),
                weightedExpense("carol", "45.00", amounts("alice", "1", "bob", "2"))));

        SettlementResult first = settlementAggregator.settle(request);
        SettlementResult second = settlementAggregator.settle(request);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("AGG-010: Itemized receipt settled end to end")
    void testItemizedReceiptSettlement() {
        // Arrange
        ItemizedCalculationRequest receipt = ItemizedCalculationRequest.builder()
                .items(List.of(item("Entree", "20.00", ItemAssignment.even("alice", "bob"))))
                .extras(Extras.builder()
                        .tax(Extra.percent(money("10"), PercentBase.PRE_TAX_ITEM_SUBTOTAL))
                        .tip(Extra.percent(money("20"), PercentBase.POST_TAX))
                        .build())
                .allocation(centsRule(RoundingMode.ROUND_HALF_UP, RemainderPolicy.LARGEST_SHARE))
                .participants(List.of("alice", "bob"))
                .payerId("alice")
                .currency(USD)
                .build();
        ItemizedCalculationResult computed = itemizedCalculator.calculate(receipt);

        Expense dinner = Expense.builder()
                .id("dinner")
                .tripId(TRIP)
                .payerUserId("alice")
                .currency(USD)
                .amount(computed.grandTotal())
                .split(new ExpenseSplit.Itemized(computed.participantAmounts(), receipt.items(), receipt.extras(),
                        receipt.allocation()))
                .description("Dinner")
                .build();

        // Act
        SettlementResult result = settlementAggregator.settle(request(List.of("alice", "bob"), List.of(dinner)));

        // Assert
        assertThat(result.isTrusted()).isTrue();
        assertThat(result.transfers()).singleElement().satisfies(t -> {
            assertThat(t.fromUserId()).isEqualTo("bob");
            assertThat(t.amountBase()).isEqualByComparingTo("13.20");
        });
        assertThat(transferBreakdownCalculator.calculateBreakdown(result.transfers().get(0), List.of(dinner))
                .netOfContributions()).isEqualByComparingTo("13.20");
    }

    @Test
    @DisplayName("AGG-011: Shares that drift from their expense amounts are caught by the balance check")
    void testConservationViolationReported() {
        // Arrange
        List<Expense> expenses = List.of(
                itemizedExpense("alice", "10.00", amounts("alice", "5.00", "bob", "4.991")),
                itemizedExpense("bob", "10.00", amounts("alice", "4.991", "bob", "5.00")));

        // Act
        SettlementResult result = settlementAggregator.settle(request(List.of("alice", "bob"), expenses));

        // Assert
        assertThat(result.isTrusted()).isFalse();
        assertThat(result.blockingErrors()).extracting(ValidationError::code, ValidationError::subjectId)
                .containsExactly(tuple(ValidationErrorCode.BALANCE_CONSERVATION_VIOLATION, TRIP));
        assertThat(result.blockingErrors().get(0).message()).contains("0.018");
        assertThat(settlementAggregator.validateBalances(result.personSummaries(), USD)).isFalse();
        assertThatThrownBy(() -> settlementAggregator.requireBalanced(result))
                .isInstanceOf(BalanceConservationException.class)
                .hasMessageContaining("0.018");
    }

    @Test
    @DisplayName("AGG-012: Expense without participants comes back as an error, not an exception")
    void testExpenseWithoutParticipants() {
        SettlementResult result = settlementAggregator.settle(SettlementRequest.builder()
                .tripId(TRIP)
                .baseCurrency(USD)
                .participants(List.of("alice", "bob"))
                .expenses(List.of(
                        equalExpense("alice", "20.00", "alice", "bob"),
                        expense("bob", "12.00", new ExpenseSplit.Equal(List.of()), "food")))
                .categories(CATEGORIES)
                .build());

        assertThat(result.isTrusted()).isFalse();
        assertThat(result.blockingErrors()).extracting(ValidationError::code)
                .containsExactly(ValidationErrorCode.INVALID_ASSIGNMENT);
        assertThat(result.personSummaries().get("bob").totalPaidBase()).isEqualByComparingTo("0");
        assertThat(result.categorySpending().get("alice").spendingFor("food")).isEqualByComparingTo("0");
        assertThat(result.transfers()).singleElement()
                .satisfies(t -> assertThat(t.amountBase()).isEqualByComparingTo("10.00"));
    }

    private static SettlementRequest request(List<String> participants, List<Expense> expenses) {
        return SettlementRequest.builder()
                .tripId(TRIP)
                .baseCurrency(USD)
                .participants(participants)
                .expenses(expenses)
                .build();
    }
}
