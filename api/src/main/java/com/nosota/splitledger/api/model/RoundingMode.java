package com.nosota.splitledger.api.model;

/**
 * Rounding applied when a raw share is brought to the configured precision.
 *
 * <p>Each mode rounds to the nearest multiple of the precision:
 * <ul>
 *   <li>ROUND_HALF_UP - ties round away from zero (2.5 → 3, -2.5 → -3)</li>
 *   <li>ROUND_HALF_EVEN - banker's rounding, ties go to the even multiple (2.5 → 2, 3.5 → 4)</li>
 *   <li>FLOOR - towards negative infinity</li>
 *   <li>CEIL - towards positive infinity</li>
 * </ul>
 */
public enum RoundingMode {
    ROUND_HALF_UP(java.math.RoundingMode.HALF_UP),
    ROUND_HALF_EVEN(java.math.RoundingMode.HALF_EVEN),
    FLOOR(java.math.RoundingMode.FLOOR),
    CEIL(java.math.RoundingMode.CEILING);

    private final java.math.RoundingMode mathRoundingMode;

    RoundingMode(java.math.RoundingMode mathRoundingMode) {
        this.mathRoundingMode = mathRoundingMode;
    }

    public java.math.RoundingMode toMathRoundingMode() {
        return mathRoundingMode;
    }
}
