package com.nosota.splitledger.api.dto;

import java.math.BigDecimal;

public record CategorySpending(
        String categoryId,
        String categoryName,
        BigDecimal amount,
        String color,
        String icon
) {
}
