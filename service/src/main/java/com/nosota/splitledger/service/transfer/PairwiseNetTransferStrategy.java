package com.nosota.splitledger.service.transfer;

import com.nosota.splitledger.api.dto.MinimalTransfer;
import com.nosota.splitledger.api.dto.PairwiseDebt;
import com.nosota.splitledger.api.model.TransferStrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One transfer per netted pair. Each transfer traces back to the expenses between its two people.
 */
@Component
@Slf4j
public class PairwiseNetTransferStrategy implements TransferStrategy {

    @Override
    public TransferStrategyType type() {
        return TransferStrategyType.PAIRWISE_NET;
    }

    @Override
    public List<MinimalTransfer> computeTransfers(SettlementContext context) {
        List<MinimalTransfer> transfers = new ArrayList<>();
        for (PairwiseDebt debt : context.pairwiseDebts()) {
            transfers.add(newTransfer(context, transfers.size(), debt.fromUserId(), debt.toUserId(),
                    debt.nettedBase()));
        }
        log.debug("Pairwise transfers for trip {}: {}", context.tripId(), transfers.size());
        return transfers;
    }
}
