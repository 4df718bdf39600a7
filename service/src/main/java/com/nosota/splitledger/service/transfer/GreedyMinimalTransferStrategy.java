package com.nosota.splitledger.service.transfer;

import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.PersonSummary;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import com.nosota.splitledger.api.model.TransferStrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Legacy strategy that matches the largest creditor with the largest debtor until one side
 * runs out, which keeps the transfer count low.
 *
 * <p>Both sides are sorted by amount descending, then by user id ascending, once up front.
 * A party leaves the matching when its remaining amount drops below the currency's smallest unit.
 */
@Component
@Slf4j
public class GreedyMinimalTransferStrategy implements TransferStrategy {

    private static final Comparator<Balance> LARGEST_FIRST = Comparator
            .comparing((Balance b) -> b.amount).reversed()
            .thenComparing(b -> b.userId);

    @Override
    public TransferStrategyType type() {
        return TransferStrategyType.GREEDY_MINIMAL;
    }

    @Override
    public List<MinimalTransfer> computeTransfers(SettlementContext context) {
        BigDecimal epsilon = CurrencyPrecision.smallestUnit(context.baseCurrency());

        List<Balance> creditors = new ArrayList<>();
        List<Balance> debtors = new ArrayList<>();
        for (PersonSummary summary : context.personSummaries().values()) {
            if (summary.netBase().compareTo(epsilon) >= 0) {
                creditors.add(new Balance(summary.userId(), summary.netBase()));
            } else if (summary.netBase().negate().compareTo(epsilon) >= 0) {
                debtors.add(new Balance(summary.userId(), summary.netBase().negate()));
            }
        }
        creditors.sort(LARGEST_FIRST);
        debtors.sort(LARGEST_FIRST);

        List<MinimalTransfer> transfers = new ArrayList<>();
        int c = 0;
        int d = 0;
        while (c < creditors.size() && d < debtors.size()) {
            Balance creditor = creditors.get(c);
            Balance debtor = debtors.get(d);
            BigDecimal amount = creditor.amount.min(debtor.amount);

            transfers.add(newTransfer(context, transfers.size(), debtor.userId, creditor.userId, amount));
            log.debug("Greedy transfer {} -> {}: {}", debtor.userId, creditor.userId, amount.toPlainString());

            creditor.amount = creditor.amount.subtract(amount);
            debtor.amount = debtor.amount.subtract(amount);
            if (creditor.amount.compareTo(epsilon) < 0) {
                c++;
            }
            if (debtor.amount.compareTo(epsilon) < 0) {
                d++;
            }
        }

        log.debug("Greedy transfers for trip {}: creditors={}, debtors={}, transfers={}",
                context.tripId(), creditors.size(), debtors.size(), transfers.size());
        return transfers;
    }

    private static class Balance {
        private final String userId;
        private BigDecimal amount;

        Balance(String userId, BigDecimal amount) {
            this.userId = userId;
            this.amount = amount;
        }
    }
}
