package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-participant audit record of an itemized calculation.
 *
 * <p>{@code total = itemsSubtotal - sum(discounts) + tax + sum(fees) + tip + roundingAdjustment}.
 *
 * @param userId             Participant
 * @param itemsSubtotal      Sum of item contributions, before extras
 * @param discounts          Discount allocated per discount label
 * @param tax                Tax allocated
 * @param fees               Fee allocated per fee label
 * @param tip                Tip allocated
 * @param roundingAdjustment Difference between the final total and the unrounded total,
 *                           including any remainder received
 * @param total              Final rounded amount owed
 * @param items              Item contributions in receipt order
 */
public record ParticipantBreakdown(
        String userId,
        BigDecimal itemsSubtotal,
        Map<String, BigDecimal> discounts,
        BigDecimal tax,
        Map<String, BigDecimal> fees,
        BigDecimal tip,
        BigDecimal roundingAdjustment,
        BigDecimal total,
        List<ItemContribution> items
) {
    public ParticipantBreakdown {
        discounts = discounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(discounts));
        fees = fees == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fees));
        items = items == null ? List.of() : List.copyOf(items);
    }
}
