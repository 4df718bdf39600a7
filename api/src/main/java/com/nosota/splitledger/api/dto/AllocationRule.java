package com.nosota.splitledger.api.dto;

import com.nosota.splitledger.api.model.AbsoluteSplitMode;
import com.nosota.splitledger.api.model.PercentBase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Allocation settings of an itemized expense.
 *
 * @param percentBase       Default base for percent extras that do not name their own
 * @param absoluteSplitMode How absolute extras are split among assigned people
 * @param rounding          Rounding configuration
 */
public record AllocationRule(
        @NotNull
        PercentBase percentBase,
        @NotNull
        AbsoluteSplitMode absoluteSplitMode,
        @NotNull
        @Valid
        RoundingConfig rounding
) {
}
