package com.sportsautobet.domain.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding for published scores.
 */
public final class Rounding {

    private Rounding() {
    }

    /**
     * Rounds the exact binary value, ties to even: 0.3125 becomes 0.312 and 0.6335
     * (stored just below the tie) becomes 0.633.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double round3(double value) {
        return round(value, 3);
    }
}
