package com.clarifi.backend.services.aggregation;

import java.math.BigDecimal;

public record BudgetLine(String categoryId, String categoryName, BigDecimal amount) {
}
