package com.nosota.splitledger.service.transfer;

import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.model.TransferStrategyType;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Turns settlement balances into payable transfers.
 */
public interface TransferStrategy {

    TransferStrategyType type();

    List<MinimalTransfer> computeTransfers(SettlementContext context);

    /**
     * Builds an unsettled transfer whose id depends only on trip, parties and position,
     * so recomputing a settlement reproduces the same ids.
     */
    default MinimalTransfer newTransfer(SettlementContext context,
                                        int sequence,
                                        String fromUserId,
                                        String toUserId,
                                        BigDecimal amount) {
        String name = String.format("%s/%s/%s/%d", context.tripId(), fromUserId, toUserId, sequence);
        UUID id = UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
        return new MinimalTransfer(id.toString(), context.tripId(), fromUserId, toUserId, amount,
                context.baseCurrency(), context.computedAt(), false, null);
    }
}
