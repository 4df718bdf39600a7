package com.nosota.splitledger.api.dto;

import com.nosota.splitledger.api.model.RemainderPolicy;
import com.nosota.splitledger.api.model.RoundingMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * How per-participant totals are rounded and who absorbs the remainder.
 *
 * @param precision       Rounding step, e.g. 0.01 for cents or 1 for VND
 * @param mode            Rounding mode
 * @param remainderPolicy Recipient of the rounding remainder
 * @param seed            Seed for {@link RemainderPolicy#DETERMINISTIC}; null uses the configured default
 */
public record RoundingConfig(
        @NotNull
        @Positive
        BigDecimal precision,
        @NotNull
        RoundingMode mode,
        @NotNull
        RemainderPolicy remainderPolicy,
        Long seed
) {
    public RoundingConfig {
        if (precision != null && precision.signum() <= 0) {
            throw new IllegalArgumentException("Precision must be positive, got " + precision);
        }
    }

    public static RoundingConfig of(BigDecimal precision, RoundingMode mode, RemainderPolicy remainderPolicy) {
        return new RoundingConfig(precision, mode, remainderPolicy, null);
    }
}
