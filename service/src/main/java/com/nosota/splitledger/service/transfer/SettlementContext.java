package com.nosota.splitledger.service.transfer;

import com.nosota.splitledger.api.dto.PairwiseDebt;
import com.nosota.splitledger.api.dto.PersonSummary;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link TransferStrategy} may draw on, computed once per settlement.
 *
 * @param tripId          Trip
 * @param baseCurrency    Currency of every amount
 * @param personSummaries Net balance per person, in participant order
 * @param pairwiseDebts   Netted debt per pair
 * @param computedAt      Timestamp for the produced transfers
 */
public record SettlementContext(
        String tripId,
        String baseCurrency,
        Map<String, PersonSummary> personSummaries,
        List<PairwiseDebt> pairwiseDebts,
        LocalDateTime computedAt
) {
}
