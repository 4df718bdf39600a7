package com.nosota.splitledger.api.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.PairwiseDebt;
import com.nosota.splitledger.api.dto.PersonCategorySpending;
import com.nosota.splitledger.api.dto.PersonSummary;
import com.nosota.splitledger.api.dto.ValidationError;
import com.nosota.splitledger.api.model.TransferStrategyType;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a settlement computation.
 *
 * @param tripId           Trip
 * @param baseCurrency     Currency of every amount
 * @param personSummaries  Paid/owed/net per person, participants first in listing order
 * @param pairwiseDebts    Net debt per pair of people
 * @param transfers        Transfers produced by {@code strategy}
 * @param strategy         Strategy that produced the transfers
 * @param categorySpending Spending per person and category; empty when no categories were supplied
 * @param errors           Blocking errors and warnings
 * @param computedAt       Computation timestamp
 */
public record SettlementResult(
        String tripId,
        String baseCurrency,
        Map<String, PersonSummary> personSummaries,
        List<PairwiseDebt> pairwiseDebts,
        List<MinimalTransfer> transfers,
        TransferStrategyType strategy,
        Map<String, PersonCategorySpending> categorySpending,
        List<ValidationError> errors,
        LocalDateTime computedAt
) {
    public SettlementResult {
        personSummaries = personSummaries == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(personSummaries));
        pairwiseDebts = pairwiseDebts == null ? List.of() : List.copyOf(pairwiseDebts);
        transfers = transfers == null ? List.of() : List.copyOf(transfers);
        categorySpending = categorySpending == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(categorySpending));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * True when no blocking error was found; the summaries and transfers can be trusted.
     */
    @JsonIgnore
    public boolean isTrusted() {
        return errors.stream().noneMatch(ValidationError::isBlocking);
    }

    public List<ValidationError> blockingErrors() {
        return errors.stream().filter(ValidationError::isBlocking).toList();
    }

    public List<ValidationError> warnings() {
        return errors.stream().filter(e -> !e.isBlocking()).toList();
    }
}
