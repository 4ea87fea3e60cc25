package com.crosslend.vault;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * {@code (collateralUsd - borrowedUsd) / borrowedUsd * 100}. With nothing borrowed the factor is
 * unbounded and {@code value} is null.
 */
public record HealthFactor(BigDecimal collateralUsd, BigDecimal borrowedUsd, BigDecimal value) {

    private static final int SCALE = 18;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static HealthFactor of(BigDecimal collateralUsd, BigDecimal borrowedUsd) {
        if (borrowedUsd.signum() <= 0) {
            return new HealthFactor(collateralUsd, BigDecimal.ZERO, null);
        }
        BigDecimal value = collateralUsd.subtract(borrowedUsd)
                .multiply(HUNDRED)
                .divide(borrowedUsd, SCALE, RoundingMode.DOWN);
        return new HealthFactor(collateralUsd, borrowedUsd, value);
    }

    public boolean unbounded() {
        return value == null;
    }

    public boolean isBelow(BigDecimal threshold) {
        return value != null && value.compareTo(threshold) < 0;
    }
}
