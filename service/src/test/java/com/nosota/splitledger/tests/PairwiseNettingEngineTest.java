package com.nosota.splitledger.tests;

import com.nosota.splitledger.TestBase;
import com.nosota.splitledger.api.dto.Expense;
import com.nosota.splitledger.api.dto.PairwiseDebt;
import com.nosota.splitledger.service.PairwiseNettingEngine.DebtDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("4. Pairwise Netting Tests")
public class PairwiseNettingEngineTest extends TestBase {

    @Test
    @DisplayName("NET-001: Two-person equal split yields one debt")
    void testTwoPersonSplit() {
        List<PairwiseDebt> debts = nettingEngine.netDebts(
                List.of(equalExpense("alice", "100.00", "alice", "bob")), USD, TestClockConfig.FIXED_TIME);

        assertThat(debts).hasSize(1);
        PairwiseDebt debt = debts.get(0);
        assertThat(debt.fromUserId()).isEqualTo("bob");
        assertThat(debt.toUserId()).isEqualTo("alice");
        assertThat(debt.nettedBase()).isEqualByComparingTo("50.00");
        assertThat(debt.computedAt()).isEqualTo(TestClockConfig.FIXED_TIME);
    }

    @Test
    @DisplayName("NET-002: Mutual debts are netted into one direction")
    void testMutualDebts() {
        List<Expense> expenses = List.of(
                equalExpense("alice", "100.00", "alice", "bob"),
                equalExpense("bob", "30.00", "alice", "bob"));

        Map<DebtDirection, BigDecimal> raw = nettingEngine.accumulateDebts(expenses);
        List<PairwiseDebt> debts = nettingEngine.netDebts(expenses, USD, TestClockConfig.FIXED_TIME);

        assertThat(raw.get(new DebtDirection("bob", "alice"))).isEqualByComparingTo("50.00");
        assertThat(raw.get(new DebtDirection("alice", "bob"))).isEqualByComparingTo("15.00");
        assertThat(debts).extracting(PairwiseDebt::fromUserId, PairwiseDebt::toUserId)
                .containsExactly(tuple("bob", "alice"));
        assertThat(debts.get(0).nettedBase()).isEqualByComparingTo("35.00");
    }

    @Test
    @DisplayName("NET-003: Net below one cent means the pair is settled")
    void testSettledPair() {
        List<PairwiseDebt> debts = nettingEngine.netDebts(List.of(
                equalExpense("alice", "40.00", "alice", "bob"),
                equalExpense("bob", "40.00", "alice", "bob")), USD, TestClockConfig.FIXED_TIME);

        assertThat(debts).isEmpty();
    }

    @Test
    @DisplayName("NET-004: Debts come out in order of first encounter of each pair")
    void testOutputOrder() {
        List<PairwiseDebt> debts = nettingEngine.netDebts(List.of(
                equalExpense("carol", "30.00", "alice", "carol"),
                equalExpense("alice", "20.00", "alice", "bob"),
                equalExpense("bob", "12.00", "bob", "carol")), USD, TestClockConfig.FIXED_TIME);

        assertThat(debts).extracting(PairwiseDebt::fromUserId, PairwiseDebt::toUserId)
                .containsExactly(
                        tuple("alice", "carol"),
                        tuple("bob", "alice"),
                        tuple("carol", "bob"));
        assertThat(debts.get(0).nettedBase()).isEqualByComparingTo("15.00");
        assertThat(debts.get(1).nettedBase()).isEqualByComparingTo("10.00");
        assertThat(debts.get(2).nettedBase()).isEqualByComparingTo("6.00");
    }

    @Test
    @DisplayName("NET-005: Itemized amounts feed the netting directly")
    void testItemizedExpense() {
        List<PairwiseDebt> debts = nettingEngine.netDebts(List.of(
                itemizedExpense("alice", "26.40", amounts("alice", "13.20", "bob", "13.20"))),
                USD, TestClockConfig.FIXED_TIME);

        assertThat(debts).singleElement()
                .satisfies(d -> assertThat(d.nettedBase()).isEqualByComparingTo("13.20"));
    }
}
