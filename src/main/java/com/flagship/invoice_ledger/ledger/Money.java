package com.flagship.invoice_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Two-decimal monetary arithmetic.
 *
 * Every stored amount passes through {@link #round(BigDecimal)}, so equality
 * checks such as amountDue == 0 compare exact values with no epsilon.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : round(value);
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }
}
