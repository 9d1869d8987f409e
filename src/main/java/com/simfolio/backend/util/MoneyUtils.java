package com.simfolio.backend.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int PERCENT_SCALE = 2;
    public static final int CENTS_SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Precision for intermediate ratios (average cost, allocation shares); never used for stored money. */
    public static final MathContext RATIO = MathContext.DECIMAL64;

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, long right) {
        return scale(scale(left).multiply(BigDecimal.valueOf(right)));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * {@code part / whole * 100} at full precision, zero when {@code whole} is not positive.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (part == null || !isPositive(whole)) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, RATIO);
    }

    public static BigDecimal roundPercent(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
