package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.PersonSummary;
import com.nosota.splitledger.api.dto.ValidationError;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import com.nosota.splitledger.api.model.ValidationErrorCode;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-checks a computed transfer list against the balances it is meant to settle.
 *
 * <p>Findings are warnings: they flag a suspicious settlement without rejecting it.
 */
@Service
@Validated
@Slf4j
public class SettlementValidator {

    /**
     * @param transfers       Transfers to check
     * @param personSummaries Balances the transfers should settle
     * @param currency        Currency whose smallest unit, times the number of people, is the tolerance
     * @return Warnings, empty when the transfers are consistent
     */
    public List<ValidationError> validate(@NotNull List<MinimalTransfer> transfers,
                                          @NotNull Map<String, PersonSummary> personSummaries,
                                          @NotNull String currency) {
        List<ValidationError> issues = new ArrayList<>();
        validateParties(transfers, personSummaries, issues);
        validateNoDuplicates(transfers, issues);
        validateAmounts(transfers, issues);
        validateBalances(transfers, personSummaries, currency, issues);

        if (!issues.isEmpty()) {
            log.warn("Settlement validation found {} issue(s) in {} transfers", issues.size(), transfers.size());
        }
        return issues;
    }

    private void validateParties(List<MinimalTransfer> transfers,
                                 Map<String, PersonSummary> personSummaries,
                                 List<ValidationError> issues) {
        for (MinimalTransfer transfer : transfers) {
            if (!personSummaries.containsKey(transfer.fromUserId())) {
                issues.add(ValidationError.warning(ValidationErrorCode.UNKNOWN_TRANSFER_PARTY, transfer.id(),
                        String.format("Transfer %s has unknown payer %s", transfer.id(), transfer.fromUserId())));
            }
            if (!personSummaries.containsKey(transfer.toUserId())) {
                issues.add(ValidationError.warning(ValidationErrorCode.UNKNOWN_TRANSFER_PARTY, transfer.id(),
                        String.format("Transfer %s has unknown receiver %s", transfer.id(), transfer.toUserId())));
            }
            if (transfer.fromUserId().equals(transfer.toUserId())) {
                issues.add(ValidationError.warning(ValidationErrorCode.SELF_TRANSFER, transfer.id(),
                        String.format("Transfer %s pays %s to themselves", transfer.id(), transfer.fromUserId())));
            }
        }
    }

    private void validateNoDuplicates(List<MinimalTransfer> transfers, List<ValidationError> issues) {
        Map<String, List<String>> idsByPair = new LinkedHashMap<>();
        for (MinimalTransfer transfer : transfers) {
            String pair = transfer.fromUserId() + "->" + transfer.toUserId();
            idsByPair.computeIfAbsent(pair, k -> new ArrayList<>()).add(transfer.id());
        }
        idsByPair.forEach((pair, ids) -> {
            if (ids.size() > 1) {
                issues.add(ValidationError.warning(ValidationErrorCode.DUPLICATE_TRANSFER, pair,
                        String.format("%d transfers for %s: %s", ids.size(), pair, ids)));
            }
        });
    }

    private void validateAmounts(List<MinimalTransfer> transfers, List<ValidationError> issues) {
        for (MinimalTransfer transfer : transfers) {
            if (transfer.amountBase().signum() <= 0) {
                issues.add(ValidationError.warning(ValidationErrorCode.NON_POSITIVE_TRANSFER, transfer.id(),
                        String.format("Transfer %s amount is not positive: %s", transfer.id(),
                                transfer.amountBase().toPlainString())));
            }
        }
    }

    // Incoming minus outgoing must match each person's net balance
    private void validateBalances(List<MinimalTransfer> transfers,
                                  Map<String, PersonSummary> personSummaries,
                                  String currency,
                                  List<ValidationError> issues) {
        BigDecimal tolerance = CurrencyPrecision.smallestUnit(currency)
                .multiply(BigDecimal.valueOf(Math.max(1, personSummaries.size())));

        for (PersonSummary summary : personSummaries.values()) {
            BigDecimal incoming = BigDecimal.ZERO;
            BigDecimal outgoing = BigDecimal.ZERO;
            for (MinimalTransfer transfer : transfers) {
                if (transfer.toUserId().equals(summary.userId())) {
                    incoming = incoming.add(transfer.amountBase());
                }
                if (transfer.fromUserId().equals(summary.userId())) {
                    outgoing = outgoing.add(transfer.amountBase());
                }
            }

            BigDecimal difference = incoming.subtract(outgoing).subtract(summary.netBase()).abs();
            if (difference.compareTo(tolerance) > 0) {
                issues.add(ValidationError.warning(ValidationErrorCode.TRANSFER_BALANCE_MISMATCH, summary.userId(),
                        String.format("Transfers settle %s for %s but the net balance is %s",
                                incoming.subtract(outgoing).toPlainString(), summary.userId(),
                                summary.netBase().toPlainString())));
            }
        }
    }
}
