package com.flagship.order_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Money helpers. Every amount in the ledger is held at two decimal places.
 */
public final class Amounts {

    public static final int SCALE = 2;
    public static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes an amount to ledger scale. Null is treated as zero.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }

    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        if (amounts == null) {
            return BigDecimal.ZERO;
        }
        return amounts.stream()
                .map(Amounts::orZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static BigDecimal maxZero(BigDecimal amount) {
        return amount.signum() < 0 ? BigDecimal.ZERO.setScale(SCALE) : amount;
    }

    /**
     * Compares two amounts allowing for a rounding tolerance.
     */
    public static boolean equalsWithin(BigDecimal left, BigDecimal right, BigDecimal tolerance) {
        return orZero(left).subtract(orZero(right)).abs().compareTo(tolerance) <= 0;
    }
}
