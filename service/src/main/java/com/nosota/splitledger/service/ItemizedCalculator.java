package com.nosota.splitledger.service;

import com.nosota.splitledger.api.dto.AllocationRule;
import com.nosota.splitledger.api.dto.Extra;
import com.nosota.splitledger.api.dto.Extras;
import com.nosota.splitledger.api.dto.ItemAssignment;
import com.nosota.splitledger.api.dto.ItemContribution;
import com.nosota.splitledger.api.dto.LineItem;
import com.nosota.splitledger.api.dto.ParticipantBreakdown;
import com.nosota.splitledger.api.dto.RoundingConfig;
import com.nosota.splitledger.api.dto.ValidationError;
import com.nosota.splitledger.api.model.AbsoluteSplitMode;
import com.nosota.splitledger.api.model.CurrencyPrecision;
import com.nosota.splitledger.api.model.ExtraType;
import com.nosota.splitledger.api.model.PercentBase;
import com.nosota.splitledger.api.model.RemainderPolicy;
import com.nosota.splitledger.api.model.ValidationErrorCode;
import com.nosota.splitledger.api.request.ItemizedCalculationRequest;
import com.nosota.splitledger.api.response.ItemizedCalculationResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a receipt across participants item by item.
 *
 * <p>Calculation order is fixed, since each step feeds the bases of the next:
 * <ol>
 *   <li>Item totals are shared among the assigned users</li>
 *   <li>Discounts reduce the subtotals</li>
 *   <li>Tax</li>
 *   <li>Fees</li>
 *   <li>Tip</li>
 *   <li>Each user's total is rounded independently</li>
 *   <li>The difference to the rounded grand total goes to one user, chosen by the remainder policy</li>
 * </ol>
 *
 * <p>Percent extras are computed per user from that user's own base; absolute extras are
 * split evenly or in proportion to the item subtotals. Problems are reported as
 * {@link ValidationError}s. Any blocking error leaves {@code participantAmounts} empty.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ItemizedCalculator {

    private final RoundingService roundingService;

    @Value("${split-ledger.itemized.extreme-percentage-threshold:50}")
    private BigDecimal extremePercentageThreshold;

    @Value("${split-ledger.itemized.share-sum-tolerance:0.0001}")
    private BigDecimal shareSumTolerance;

    /**
     * Calculates what each participant owes for an itemized receipt.
     *
     * @param request Items, extras, allocation rule, participants, payer and currency
     * @return Rounded amounts summing to the grand total, per-user audit breakdowns and errors
     */
    public ItemizedCalculationResult calculate(@NotNull @Valid ItemizedCalculationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        validateItems(request, errors);
        validateExtras(request.extras(), request.allocation(), errors);

        List<String> assignedParticipants = assignedParticipants(request);
        validatePayer(request, assignedParticipants, errors);

        if (hasBlocking(errors)) {
            log.info("Itemized calculation rejected before allocation: items={}, errors={}",
                    request.items().size(), errors.size());
            return new ItemizedCalculationResult(Map.of(), Map.of(), null, errors);
        }

        Map<String, ParticipantLedger> ledgers = new LinkedHashMap<>();
        assignedParticipants.forEach(userId -> ledgers.put(userId, new ParticipantLedger(userId)));
        Subtotals receipt = new Subtotals();

        // 1. Items
        for (LineItem item : request.items()) {
            allocateItem(item, ledgers, receipt);
        }

        // 2-5. Extras, each stage complete before the next reads its base
        Extras extras = request.extras();
        AllocationRule rule = request.allocation();
        for (Extra discount : extras.discounts()) {
            allocateExtra(discount, ExtraKind.DISCOUNT, rule, ledgers, receipt);
        }
        if (extras.tax() != null) {
            allocateExtra(extras.tax(), ExtraKind.TAX, rule, ledgers, receipt);
        }
        for (Extra fee : extras.fees()) {
            allocateExtra(fee, ExtraKind.FEE, rule, ledgers, receipt);
        }
        if (extras.tip() != null) {
            allocateExtra(extras.tip(), ExtraKind.TIP, rule, ledgers, receipt);
        }

        // 6-8. Totals, rounding and remainder
        RoundingConfig rounding = rule.rounding();
        Map<String, BigDecimal> rawTotals = new LinkedHashMap<>();
        Map<String, BigDecimal> roundedTotals = new LinkedHashMap<>();
        ledgers.forEach((userId, ledger) -> {
            rawTotals.put(userId, ledger.total());
            roundedTotals.put(userId, roundingService.round(ledger.total(), rounding.precision(), rounding.mode()));
        });

        BigDecimal grandTotal = roundingService.round(receipt.total(), rounding.precision(), rounding.mode());
        BigDecimal remainder = grandTotal.subtract(MoneyMath.sum(roundedTotals.values()));
        BigDecimal maxRemainder = rounding.precision().multiply(BigDecimal.valueOf(ledgers.size()));

        Map<String, BigDecimal> finalAmounts;
        if (remainder.abs().compareTo(maxRemainder) > 0) {
            log.error("Rounding remainder {} exceeds one step per participant ({}) for grand total {}",
                    remainder.toPlainString(), maxRemainder.toPlainString(), grandTotal.toPlainString());
            errors.add(ValidationError.blocking(ValidationErrorCode.COMPUTATION_MISMATCH, null,
                    String.format("Rounding remainder %s exceeds %s", remainder.toPlainString(),
                            maxRemainder.toPlainString())));
            finalAmounts = roundedTotals;
        } else {
            finalAmounts = roundingService.distributeRemainder(roundedTotals, rawTotals, remainder,
                    rounding.remainderPolicy(), request.payerId(), rounding.seed());
        }

        // 9. Post-calculation checks
        verifyTotals(finalAmounts, grandTotal, request.currency(), errors);

        Map<String, ParticipantBreakdown> breakdown = new LinkedHashMap<>();
        ledgers.forEach((userId, ledger) -> breakdown.put(userId, ledger.toBreakdown(finalAmounts.get(userId))));

        boolean blocked = hasBlocking(errors);
        log.info("Itemized calculation: items={}, participants={}, grandTotal={}, remainder={}, errors={}, blocked={}",
                request.items().size(), ledgers.size(), grandTotal.toPlainString(), remainder.toPlainString(),
                errors.size(), blocked);

        return new ItemizedCalculationResult(blocked ? Map.of() : finalAmounts, breakdown, grandTotal, errors);
    }

    // ==================== Allocation ====================

    private void allocateItem(LineItem item, Map<String, ParticipantLedger> ledgers, Subtotals receipt) {
        BigDecimal itemTotal = item.itemTotal();
        receipt.addItem(itemTotal, item.taxable());

        ItemAssignment assignment = item.assignment();
        List<String> users = assignment.users();
        for (String userId : users) {
            BigDecimal share;
            BigDecimal amount;
            if (assignment instanceof ItemAssignment.Custom custom) {
                share = custom.shares().get(userId);
                amount = itemTotal.multiply(share);
            } else {
                share = MoneyMath.divide(BigDecimal.ONE, users.size());
                amount = MoneyMath.divide(itemTotal, users.size());
            }

            ParticipantLedger ledger = ledgers.get(userId);
            ledger.addItem(amount, item.taxable());
            ledger.contributions.add(new ItemContribution(item.id(), item.name(), item.quantity(),
                    item.unitPrice(), share, amount));
        }

        log.debug("Item {} ({}) total {} shared by {}", item.id(), item.name(), itemTotal.toPlainString(), users);
    }

    private void allocateExtra(Extra extra,
                               ExtraKind kind,
                               AllocationRule rule,
                               Map<String, ParticipantLedger> ledgers,
                               Subtotals receipt) {
        Map<String, BigDecimal> perUser = new LinkedHashMap<>();
        BigDecimal aggregate;

        if (extra.type() == ExtraType.PERCENT) {
            PercentBase base = effectiveBase(extra, rule);
            ledgers.forEach((userId, ledger) ->
                    perUser.put(userId, MoneyMath.percentOf(ledger.base(base), extra.value())));
            aggregate = MoneyMath.percentOf(receipt.base(base), extra.value());
        } else {
            aggregate = extra.value();
            perUser.putAll(splitAbsolute(extra.value(), rule.absoluteSplitMode(), ledgers));
        }

        String label = extra.label() != null ? extra.label() : kind.label;
        perUser.forEach((userId, amount) -> ledgers.get(userId).addExtra(kind, label, amount));
        receipt.addExtra(kind, aggregate);

        log.debug("{} '{}' of {} {} allocated as {}", kind.label, label, extra.type(),
                extra.value().toPlainString(), perUser);
    }

    private Map<String, BigDecimal> splitAbsolute(BigDecimal amount,
                                                  AbsoluteSplitMode mode,
                                                  Map<String, ParticipantLedger> ledgers) {
        BigDecimal itemsTotal = MoneyMath.sum(ledgers.values().stream().map(l -> l.items).toList());
        // Nothing to be proportional to: fall back to an even split
        boolean even = mode == AbsoluteSplitMode.EVEN || itemsTotal.signum() == 0;

        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        ledgers.forEach((userId, ledger) -> shares.put(userId, even
                ? MoneyMath.divide(amount, ledgers.size())
                : MoneyMath.divide(amount.multiply(ledger.items), itemsTotal)));
        return shares;
    }

    private PercentBase effectiveBase(Extra extra, AllocationRule rule) {
        return extra.base() != null ? extra.base() : rule.percentBase();
    }

    // ==================== Validation ====================

    private void validateItems(ItemizedCalculationRequest request, List<ValidationError> errors) {
        if (request.items().isEmpty()) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_LINE_ITEM, null,
                    "Receipt has no line items"));
            return;
        }

        Set<String> participants = new HashSet<>(request.participants());
        Set<String> seenIds = new HashSet<>();
        for (LineItem item : request.items()) {
            if (!seenIds.add(item.id())) {
                errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_LINE_ITEM, item.id(),
                        String.format("Duplicate line item id %s", item.id())));
            }
            if (item.name() == null || item.name().isBlank()) {
                errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_LINE_ITEM, item.id(),
                        String.format("Line item %s has no name", item.id())));
            }
            if (item.quantity().signum() <= 0) {
                errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_LINE_ITEM, item.id(),
                        String.format("Line item %s quantity must be positive, got %s",
                                item.id(), item.quantity().toPlainString())));
            }
            if (item.unitPrice().signum() < 0) {
                errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_LINE_ITEM, item.id(),
                        String.format("Line item %s unit price must not be negative, got %s",
                                item.id(), item.unitPrice().toPlainString())));
            }
            validateAssignment(item, participants, errors);
        }
    }

    private void validateAssignment(LineItem item, Set<String> participants, List<ValidationError> errors) {
        ItemAssignment assignment = item.assignment();
        if (assignment == null || assignment.users().isEmpty()) {
            errors.add(ValidationError.blocking(ValidationErrorCode.UNASSIGNED_ITEM, item.id(),
                    String.format("Line item %s is not assigned to anyone", item.id())));
            return;
        }

        List<String> users = assignment.users();
        if (new HashSet<>(users).size() != users.size()) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_ASSIGNMENT, item.id(),
                    String.format("Line item %s lists a user more than once: %s", item.id(), users)));
        }
        for (String userId : users) {
            if (!participants.contains(userId)) {
                errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_ASSIGNMENT, item.id(),
                        String.format("Line item %s is assigned to %s, who is not a participant", item.id(), userId)));
            }
        }

        if (assignment instanceof ItemAssignment.Custom custom) {
            validateCustomShares(item.id(), custom, errors);
        }
    }

    private void validateCustomShares(String itemId, ItemAssignment.Custom custom, List<ValidationError> errors) {
        if (!custom.shares().keySet().equals(new HashSet<>(custom.users()))) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_ASSIGNMENT, itemId,
                    String.format("Line item %s shares %s do not match users %s",
                            itemId, custom.shares().keySet(), custom.users())));
            return;
        }

        boolean negative = custom.shares().values().stream().anyMatch(s -> s == null || s.signum() < 0);
        if (negative) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_ASSIGNMENT, itemId,
                    String.format("Line item %s has a missing or negative share", itemId)));
            return;
        }

        BigDecimal sum = MoneyMath.sum(custom.shares().values());
        if (sum.subtract(BigDecimal.ONE).abs().compareTo(shareSumTolerance) > 0) {
            errors.add(ValidationError.blocking(ValidationErrorCode.SHARES_DO_NOT_SUM_TO_ONE, itemId,
                    String.format("Line item %s shares sum to %s instead of 1", itemId, sum.toPlainString())));
        }
    }

    private void validateExtras(Extras extras, AllocationRule rule, List<ValidationError> errors) {
        for (Extra discount : extras.discounts()) {
            validateExtra(discount, ExtraKind.DISCOUNT, rule, errors);
        }
        if (extras.tax() != null) {
            validateExtra(extras.tax(), ExtraKind.TAX, rule, errors);
        }
        for (Extra fee : extras.fees()) {
            validateExtra(fee, ExtraKind.FEE, rule, errors);
        }
        if (extras.tip() != null) {
            validateExtra(extras.tip(), ExtraKind.TIP, rule, errors);
        }
    }

    private void validateExtra(Extra extra, ExtraKind kind, AllocationRule rule, List<ValidationError> errors) {
        String subject = extra.id() != null ? extra.id() : kind.label;

        boolean valueOk = kind.allowsZero ? extra.value().signum() >= 0 : extra.value().signum() > 0;
        if (!valueOk) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_EXTRA, subject,
                    String.format("%s value must be %s, got %s", kind.label,
                            kind.allowsZero ? "zero or more" : "positive", extra.value().toPlainString())));
        }

        if (kind.named && (isBlank(extra.id()) || isBlank(extra.name()))) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_EXTRA, subject,
                    String.format("%s requires an id and a name", kind.label)));
        }

        if (extra.type() == ExtraType.ABSOLUTE) {
            if (extra.base() != null) {
                errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_EXTRA, subject,
                        String.format("Absolute %s must not carry a percent base", kind.label)));
            }
            return;
        }

        PercentBase base = effectiveBase(extra, rule);
        if (base.stage() > kind.maxStage) {
            errors.add(ValidationError.blocking(ValidationErrorCode.INVALID_EXTRA, subject,
                    String.format("%s cannot be computed on %s", kind.label, base)));
        }

        if (kind.sanityChecked && extra.value().compareTo(extremePercentageThreshold) > 0) {
            log.warn("Extreme {} percentage {}% above threshold {}%", kind.label,
                    extra.value().toPlainString(), extremePercentageThreshold.toPlainString());
            errors.add(ValidationError.warning(ValidationErrorCode.EXTREME_PERCENTAGE, subject,
                    String.format("%s of %s%% exceeds %s%%", kind.label, extra.value().toPlainString(),
                            extremePercentageThreshold.toPlainString())));
        }
    }

    private void validatePayer(ItemizedCalculationRequest request,
                               List<String> assignedParticipants,
                               List<ValidationError> errors) {
        if (request.allocation().rounding().remainderPolicy() != RemainderPolicy.PAYER) {
            return;
        }
        if (!assignedParticipants.contains(request.payerId())) {
            errors.add(ValidationError.blocking(ValidationErrorCode.PAYER_NOT_PARTICIPANT, request.payerId(),
                    String.format("Remainder goes to the payer, but payer %s holds no assigned item",
                            request.payerId())));
        }
    }

    private void verifyTotals(Map<String, BigDecimal> finalAmounts,
                              BigDecimal grandTotal,
                              String currency,
                              List<ValidationError> errors) {
        finalAmounts.forEach((userId, amount) -> {
            if (amount.signum() < 0) {
                errors.add(ValidationError.blocking(ValidationErrorCode.NEGATIVE_TOTAL, userId,
                        String.format("Total for %s is negative: %s", userId, amount.toPlainString())));
            }
        });

        BigDecimal epsilon = CurrencyPrecision.smallestUnit(currency);
        BigDecimal distributed = MoneyMath.sum(finalAmounts.values());
        if (distributed.subtract(grandTotal).abs().compareTo(epsilon) >= 0) {
            log.error("Distributed amounts {} do not match grand total {}", distributed.toPlainString(),
                    grandTotal.toPlainString());
            errors.add(ValidationError.blocking(ValidationErrorCode.COMPUTATION_MISMATCH, null,
                    String.format("Distributed %s but grand total is %s", distributed.toPlainString(),
                            grandTotal.toPlainString())));
        }
    }

    // Participants holding at least one assigned item, in participant-list order
    private List<String> assignedParticipants(ItemizedCalculationRequest request) {
        Set<String> assigned = new LinkedHashSet<>();
        for (LineItem item : request.items()) {
            if (item.assignment() != null) {
                assigned.addAll(item.assignment().users());
            }
        }
        return request.participants().stream().filter(assigned::contains).distinct().toList();
    }

    private static boolean hasBlocking(Collection<ValidationError> errors) {
        return errors.stream().anyMatch(ValidationError::isBlocking);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ==================== Accumulators ====================

    /**
     * Which extra is being applied, with the latest base it may read and its value rules.
     */
    private enum ExtraKind {
        DISCOUNT("discount", 0, false, true, false),
        TAX("tax", 1, false, false, true),
        FEE("fee", 2, false, true, false),
        TIP("tip", 3, true, false, true);

        private final String label;
        private final int maxStage;
        private final boolean allowsZero;
        private final boolean named;
        private final boolean sanityChecked;

        ExtraKind(String label, int maxStage, boolean allowsZero, boolean named, boolean sanityChecked) {
            this.label = label;
            this.maxStage = maxStage;
            this.allowsZero = allowsZero;
            this.named = named;
            this.sanityChecked = sanityChecked;
        }
    }

    /**
     * Running subtotals, either of one participant or of the whole receipt.
     */
    private static class Subtotals {
        BigDecimal items = BigDecimal.ZERO;
        BigDecimal taxableItems = BigDecimal.ZERO;
        BigDecimal discounts = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        BigDecimal tip = BigDecimal.ZERO;

        void addItem(BigDecimal amount, boolean taxable) {
            items = items.add(amount);
            if (taxable) {
                taxableItems = taxableItems.add(amount);
            }
        }

        void addExtra(ExtraKind kind, BigDecimal amount) {
            switch (kind) {
                case DISCOUNT -> discounts = discounts.add(amount);
                case TAX -> tax = tax.add(amount);
                case FEE -> fees = fees.add(amount);
                case TIP -> tip = tip.add(amount);
            }
        }

        BigDecimal base(PercentBase base) {
            return switch (base) {
                case PRE_TAX_ITEM_SUBTOTAL -> items;
                case TAXABLE_ITEMS_ONLY -> taxableItems;
                case POST_DISCOUNT -> items.subtract(discounts);
                case POST_TAX -> items.subtract(discounts).add(tax);
                case POST_FEES -> items.subtract(discounts).add(tax).add(fees);
            };
        }

        BigDecimal total() {
            return base(PercentBase.POST_FEES).add(tip);
        }
    }

    /**
     * One participant's subtotals plus the audit detail that ends up in the breakdown.
     */
    private static class ParticipantLedger extends Subtotals {
        final String userId;
        final Map<String, BigDecimal> discountsByLabel = new LinkedHashMap<>();
        final Map<String, BigDecimal> feesByLabel = new LinkedHashMap<>();
        final List<ItemContribution> contributions = new ArrayList<>();

        ParticipantLedger(String userId) {
            this.userId = userId;
        }

        void addExtra(ExtraKind kind, String label, BigDecimal amount) {
            addExtra(kind, amount);
            if (kind == ExtraKind.DISCOUNT) {
                discountsByLabel.merge(label, amount, BigDecimal::add);
            } else if (kind == ExtraKind.FEE) {
                feesByLabel.merge(label, amount, BigDecimal::add);
            }
        }

        ParticipantBreakdown toBreakdown(BigDecimal finalAmount) {
            return new ParticipantBreakdown(userId, items, discountsByLabel, tax, feesByLabel, tip,
                    finalAmount.subtract(total()), finalAmount, contributions);
        }
    }
}
