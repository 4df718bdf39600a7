package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Net debt between two people after mutual debts cancel out. Always positive;
 * the direction is {@code fromUserId → toUserId}.
 */
public record PairwiseDebt(
        String fromUserId,
        String toUserId,
        BigDecimal nettedBase,
        LocalDateTime computedAt
) {
}
