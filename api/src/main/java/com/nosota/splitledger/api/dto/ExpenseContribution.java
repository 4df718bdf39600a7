package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;

/**
 * Effect of one expense on a transfer between two people.
 *
 * @param expenseId       Expense
 * @param description     Expense description
 * @param fromPaid        Amount the transfer sender paid for the expense
 * @param fromOwes        Sender's share of the expense
 * @param toPaid          Amount the transfer receiver paid for the expense
 * @param toOwes          Receiver's share of the expense
 * @param netContribution Direct debt created between the two: positive adds to the transfer,
 *                        negative reduces it, zero when a third party paid
 */
public record ExpenseContribution(
        String expenseId,
        String description,
        BigDecimal fromPaid,
        BigDecimal fromOwes,
        BigDecimal toPaid,
        BigDecimal toOwes,
        BigDecimal netContribution
) {
}
