package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.RoundingConfig;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import com.nosota.splitledger.api.model.RemainderPolicy;
import com.nosota.splitledger.api.model.RoundingMode;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Rounds money to a precision and hands the rounding remainder to exactly one party.
 *
 * <p>All operations are pure: identical arguments produce identical results, including
 * the {@link RemainderPolicy#DETERMINISTIC} policy, which draws from a seeded generator.
 */
@Service
@Validated
@Slf4j
public class RoundingService {

    @Value("${split-ledger.rounding.deterministic-seed:42}")
    private long defaultSeed;

    /**
     * Rounds {@code amount} to the nearest multiple of {@code precision}.
     *
     * @param amount    Amount to round
     * @param precision Positive step, e.g. 0.01 or 1
     * @param mode      Tie and direction handling
     * @return Rounded amount, carrying the scale of {@code precision}
     */
    public BigDecimal round(@NotNull BigDecimal amount, @NotNull BigDecimal precision, @NotNull RoundingMode mode) {
        if (precision.signum() <= 0) {
            throw new IllegalArgumentException(
                    String.format("Rounding precision must be positive, got %s", precision.toPlainString()));
        }
        BigDecimal steps = amount.divide(precision, 0, mode.toMathRoundingMode());
        BigDecimal rounded = steps.multiply(precision);
        return rounded.scale() < 0 ? rounded.setScale(0) : rounded;
    }

    /**
     * Rounds {@code amount} to the smallest unit of an ISO 4217 currency.
     */
    public BigDecimal round(@NotNull BigDecimal amount, @NotNull String currency, @NotNull RoundingMode mode) {
        return round(amount, CurrencyPrecision.smallestUnit(currency), mode);
    }

    /**
     * Picks the single party that absorbs a rounding remainder.
     *
     * @param rawAmounts Pre-rounding amounts in iteration order
     * @param policy     Selection policy
     * @param payerId    Payer, required by {@link RemainderPolicy#PAYER}
     * @param seed       Seed for {@link RemainderPolicy#DETERMINISTIC}; null uses the configured one
     * @return Key of the chosen party
     * @throws IllegalArgumentException if there are no parties, or the payer is not among them
     */
    public String selectRemainderRecipient(@NotNull Map<String, BigDecimal> rawAmounts,
                                           @NotNull RemainderPolicy policy,
                                           String payerId,
                                           Long seed) {
        if (rawAmounts.isEmpty()) {
            throw new IllegalArgumentException("Cannot select a remainder recipient among zero parties");
        }

        List<String> keys = new ArrayList<>(rawAmounts.keySet());
        return switch (policy) {
            case LARGEST_SHARE -> largestShare(rawAmounts);
            case PAYER -> {
                if (payerId == null || !rawAmounts.containsKey(payerId)) {
                    throw new IllegalArgumentException(
                            String.format("Payer %s is not among the remainder candidates %s", payerId, keys));
                }
                yield payerId;
            }
            case FIRST_LISTED -> keys.get(0);
            case DETERMINISTIC -> {
                long effectiveSeed = seed != null ? seed : defaultSeed;
                yield keys.get(new Random(effectiveSeed).nextInt(keys.size()));
            }
        };
    }

    /**
     * Adds the whole {@code remainder} to one party of {@code roundedAmounts}.
     *
     * <p>The remainder is never split: exactly one amount changes, and only when the
     * remainder is non-zero.
     *
     * @param roundedAmounts Independently rounded amounts
     * @param rawAmounts     Pre-rounding amounts used by {@link RemainderPolicy#LARGEST_SHARE}; the candidates
     * @param remainder      Target total minus the sum of rounded amounts
     * @return New map in the iteration order of {@code roundedAmounts}
     */
    public Map<String, BigDecimal> distributeRemainder(@NotNull Map<String, BigDecimal> roundedAmounts,
                                                       @NotNull Map<String, BigDecimal> rawAmounts,
                                                       @NotNull BigDecimal remainder,
                                                       @NotNull RemainderPolicy policy,
                                                       String payerId,
                                                       Long seed) {
        Map<String, BigDecimal> result = new LinkedHashMap<>(roundedAmounts);
        if (remainder.signum() == 0) {
            return result;
        }

        String recipient = selectRemainderRecipient(rawAmounts, policy, payerId, seed);
        if (!result.containsKey(recipient)) {
            throw new IllegalStateException(
                    String.format("Remainder recipient %s has no rounded amount", recipient));
        }
        result.merge(recipient, remainder, BigDecimal::add);

        log.debug("Remainder {} assigned to {} by policy {}", remainder.toPlainString(), recipient, policy);
        return result;
    }

    /**
     * Rounds each raw amount under {@code config} and distributes the difference to
     * {@code targetTotal}, so the result sums to it exactly.
     *
     * @param rawAmounts  Pre-rounding amounts in iteration order
     * @param targetTotal Total the result must sum to; must be a multiple of the precision
     * @param config      Precision, mode and remainder policy
     * @param payerId     Payer, required by {@link RemainderPolicy#PAYER}
     */
    public Map<String, BigDecimal> roundAmounts(@NotNull Map<String, BigDecimal> rawAmounts,
                                                @NotNull BigDecimal targetTotal,
                                                @NotNull RoundingConfig config,
                                                String payerId) {
        Map<String, BigDecimal> rounded = new LinkedHashMap<>();
        rawAmounts.forEach((id, raw) -> rounded.put(id, round(raw, config.precision(), config.mode())));

        BigDecimal remainder = targetTotal.subtract(MoneyMath.sum(rounded.values()));
        return distributeRemainder(rounded, rawAmounts, remainder, config.remainderPolicy(), payerId, config.seed());
    }

    // Largest absolute raw amount; ties go to the earliest party.
    private String largestShare(Map<String, BigDecimal> rawAmounts) {
        String best = null;
        BigDecimal bestAbs = null;
        for (Map.Entry<String, BigDecimal> entry : rawAmounts.entrySet()) {
            BigDecimal abs = MoneyMath.orZero(entry.getValue()).abs();
            if (bestAbs == null || abs.compareTo(bestAbs) > 0) {
                best = entry.getKey();
                bestAbs = abs;
            }
        }
        return best;
    }
}
