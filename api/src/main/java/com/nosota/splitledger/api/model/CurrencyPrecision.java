package com.nosota.splitledger.api.model;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Locale;

/**
 * ISO 4217 minor-unit precision lookup.
 *
 * <p>Examples: VND, JPY, KRW → 0 fraction digits; USD, EUR → 2; BHD, KWD, OMR → 3.
 * Unknown codes default to 2.
 */
public final class CurrencyPrecision {

    public static final int DEFAULT_FRACTION_DIGITS = 2;

    private CurrencyPrecision() {
    }

    public static int fractionDigits(String currencyCode) {
        if (currencyCode == null || currencyCode.isBlank()) {
            return DEFAULT_FRACTION_DIGITS;
        }
        try {
            int digits = Currency.getInstance(currencyCode.trim().toUpperCase(Locale.ROOT)).getDefaultFractionDigits();
            // pseudo-currencies (XAU, XXX) report -1
            return digits < 0 ? DEFAULT_FRACTION_DIGITS : digits;
        } catch (IllegalArgumentException e) {
            return DEFAULT_FRACTION_DIGITS;
        }
    }

    /**
     * Smallest representable amount of the currency, e.g. 0.01 for USD and 1 for VND.
     * This is the epsilon used by every conservation check.
     */
    public static BigDecimal smallestUnit(String currencyCode) {
        return BigDecimal.ONE.movePointLeft(fractionDigits(currencyCode));
    }
}
