package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment instruction that settles part of a trip's balances.
 *
 * <p>Transfers are created unsettled. Marking a transfer settled is done by the persistence
 * layer via {@link #markSettled(LocalDateTime)}, which returns a new record.
 *
 * @param id         Stable identifier derived from trip, parties and position
 * @param tripId     Trip
 * @param fromUserId Payer of the transfer
 * @param toUserId   Receiver of the transfer
 * @param amountBase Amount in base currency, always positive
 * @param currency   Base currency code
 * @param computedAt When the transfer was computed
 * @param settled    Whether the transfer was paid
 * @param settledAt  When it was marked settled, null while unsettled
 */
public record MinimalTransfer(
        String id,
        String tripId,
        String fromUserId,
        String toUserId,
        BigDecimal amountBase,
        String currency,
        LocalDateTime computedAt,
        boolean settled,
        LocalDateTime settledAt
) {
    public MinimalTransfer markSettled(LocalDateTime at) {
        return new MinimalTransfer(id, tripId, fromUserId, toUserId, amountBase, currency, computedAt, true, at);
    }
}
