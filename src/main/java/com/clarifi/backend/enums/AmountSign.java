package com.clarifi.backend.enums;

/**
 * Sign filter for amount aggregations: incomes are stored positive, expenses negative.
 */
public enum AmountSign {
    POSITIVE,
    NEGATIVE
}
