package com.nosota.splitledger.api.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.nosota.splitledger.api.dto.ParticipantBreakdown;
import com.nosota.splitledger.api.dto.ValidationError;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of an itemized calculation.
 *
 * <p>When any error is blocking, {@code participantAmounts} is empty and must not be stored.
 * Breakdowns are still returned when the computation got far enough to produce them.
 *
 * @param participantAmounts   Final rounded amount per participant, summing to {@code grandTotal}
 * @param participantBreakdown Audit record per participant
 * @param grandTotal           Rounded receipt total
 * @param errors               Blocking errors and warnings
 */
public record ItemizedCalculationResult(
        Map<String, BigDecimal> participantAmounts,
        Map<String, ParticipantBreakdown> participantBreakdown,
        BigDecimal grandTotal,
        List<ValidationError> errors
) {
    public ItemizedCalculationResult {
        participantAmounts = participantAmounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(participantAmounts));
        participantBreakdown = participantBreakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(participantBreakdown));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return errors.stream().noneMatch(ValidationError::isBlocking);
    }

    public List<ValidationError> blockingErrors() {
        return errors.stream().filter(ValidationError::isBlocking).toList();
    }

    public List<ValidationError> warnings() {
        return errors.stream().filter(e -> !e.isBlocking()).toList();
    }
}
