package com.clarifi.backend.services.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Numeric normalization for aggregate values coming out of the storage layer.
 */
public final class AmountUtils {

    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private static final int PERCENT_SCALE = 2;
    private static final int DIVISION_SCALE = 6;

    private AmountUtils() {
    }

    public static BigDecimal toAmount(BigDecimal raw) {
        return raw != null ? raw : BigDecimal.ZERO;
    }

    public static BigDecimal absAmount(BigDecimal raw) {
        return toAmount(raw).abs();
    }

    /**
     * {@code part / total * 100} with two decimals, or zero when {@code total} is not positive.
     */
    public static BigDecimal percentageOf(BigDecimal part, BigDecimal total) {
        BigDecimal safeTotal = toAmount(total);
        if (safeTotal.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return toAmount(part)
                .multiply(ONE_HUNDRED)
                .divide(safeTotal, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Raw change ratio {@code (current - previous) / previous * 100}; callers must ensure {@code previous > 0}.
     */
    public static BigDecimal changePercentage(BigDecimal current, BigDecimal previous) {
        return toAmount(current)
                .subtract(previous)
                .multiply(ONE_HUNDRED)
                .divide(previous, DIVISION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code part / total * 100} rounded to the nearest integer, or zero when {@code total} is not positive.
     */
    public static int roundedPercentage(BigDecimal part, BigDecimal total) {
        BigDecimal safeTotal = toAmount(total);
        if (safeTotal.signum() <= 0) {
            return 0;
        }
        return toAmount(part)
                .multiply(ONE_HUNDRED)
                .divide(safeTotal, 0, RoundingMode.HALF_UP)
                .intValue();
    }

    public static int roundToInt(BigDecimal value) {
        return toAmount(value).setScale(0, RoundingMode.HALF_UP).intValue();
    }
}
