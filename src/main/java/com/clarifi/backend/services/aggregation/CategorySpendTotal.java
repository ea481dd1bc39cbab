package com.clarifi.backend.services.aggregation;

import java.math.BigDecimal;

/**
 * Expense total of one category inside a window. {@code amount} is already an absolute value.
 */
public record CategorySpendTotal(
        String categoryId,
        String categoryName,
        String categoryIcon,
        String categoryColor,
        BigDecimal amount,
        long transactionCount
) {
    public static final String UNCATEGORIZED_ID = "uncategorized";
    public static final String UNCATEGORIZED_NAME = "Uncategorized";
}
