package com.flagship.accounting_ledger.totals;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal helpers shared by every monetary computation.
 *
 * Amounts are persisted as NUMERIC(19,4); normalising to the same scale in
 * memory keeps {@code compareTo}/{@code equals} agreement with what the
 * database hands back.
 */
public final class Money {

    public static final int SCALE = 4;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
        // Utility class
    }

    public static BigDecimal of(String value) {
        return normalize(new BigDecimal(value));
    }

    public static BigDecimal normalize(BigDecimal value) {
        return value == null ? ZERO : value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : value;
    }

    public static BigDecimal percentOf(BigDecimal base, BigDecimal ratePercent) {
        return normalize(base.multiply(ratePercent).divide(HUNDRED));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }
}
