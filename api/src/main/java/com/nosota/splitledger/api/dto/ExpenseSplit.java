package com.nosota.splitledger.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How an expense is divided among its participants.
 *
 * <p>Itemized-only data (receipt lines, extras, the computed per-participant amounts) is
 * reachable only through the {@link Itemized} variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExpenseSplit.Equal.class, name = "equal"),
        @JsonSubTypes.Type(value = ExpenseSplit.Weighted.class, name = "weighted"),
        @JsonSubTypes.Type(value = ExpenseSplit.Itemized.class, name = "itemized")
})
public sealed interface ExpenseSplit permits ExpenseSplit.Equal, ExpenseSplit.Weighted, ExpenseSplit.Itemized {

    /**
     * Participants in listing order.
     */
    List<String> participantIds();

    /**
     * Every participant pays {@code amount / participantCount}.
     */
    record Equal(List<String> participants) implements ExpenseSplit {
        public Equal {
            participants = participants == null ? List.of() : List.copyOf(participants);
        }

        @Override
        public List<String> participantIds() {
            return participants;
        }
    }

    /**
     * Every participant pays {@code amount * weight / sum(weights)}.
     */
    record Weighted(Map<String, BigDecimal> weights) implements ExpenseSplit {
        public Weighted {
            weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        }

        @Override
        public List<String> participantIds() {
            return List.copyOf(weights.keySet());
        }
    }

    /**
     * Receipt split. {@code participantAmounts} is the output of the itemized calculator and is
     * the source of truth for settlement; items, extras and allocation are kept for audit.
     */
    record Itemized(
            Map<String, BigDecimal> participantAmounts,
            List<LineItem> items,
            Extras extras,
            AllocationRule allocation
    ) implements ExpenseSplit {
        public Itemized {
            participantAmounts = participantAmounts == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(participantAmounts));
            items = items == null ? List.of() : List.copyOf(items);
        }

        public static Itemized of(Map<String, BigDecimal> participantAmounts) {
            return new Itemized(participantAmounts, List.of(), null, null);
        }

        @Override
        public List<String> participantIds() {
            return List.copyOf(participantAmounts.keySet());
        }
    }
}
