package com.nosota.splitledger.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Who shares a line item and in what proportion.
 *
 * <ul>
 *   <li>{@link Even} - the item total is divided equally among {@code users}</li>
 *   <li>{@link Custom} - each user pays {@code itemTotal * shares[user]}; shares are
 *       non-negative, sum to 1 and are keyed by exactly the {@code users}</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "mode")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ItemAssignment.Even.class, name = "even"),
        @JsonSubTypes.Type(value = ItemAssignment.Custom.class, name = "custom")
})
public sealed interface ItemAssignment permits ItemAssignment.Even, ItemAssignment.Custom {

    List<String> users();

    static Even even(String... users) {
        return new Even(List.of(users));
    }

    record Even(List<String> users) implements ItemAssignment {
        public Even {
            users = users == null ? List.of() : List.copyOf(users);
        }
    }

    record Custom(List<String> users, Map<String, BigDecimal> shares) implements ItemAssignment {
        public Custom {
            users = users == null ? List.of() : List.copyOf(users);
            shares = shares == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(shares));
        }
    }
}
