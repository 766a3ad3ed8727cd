package com.stableledger.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * 18-decimal fixed-point helpers. Every division rounds toward negative infinity so that a payout
 * is never larger than the exact value.
 */
public final class FixedPoint {

    public static final int SCALE = 18;
    public static final RoundingMode ROUNDING = RoundingMode.FLOOR;
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);
    public static final BigDecimal BPS_DENOMINATOR = BigDecimal.valueOf(10_000);

    private FixedPoint() {
    }

    public static BigDecimal of(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    /** a × b truncated to {@code scale}. */
    public static BigDecimal mul(BigDecimal a, BigDecimal b, int scale) {
        return a.multiply(b).setScale(scale, ROUNDING);
    }

    public static BigDecimal mul(BigDecimal a, BigDecimal b) {
        return mul(a, b, SCALE);
    }

    /** a ÷ b floored to {@code scale}. */
    public static BigDecimal div(BigDecimal a, BigDecimal b, int scale) {
        return a.divide(b, scale, ROUNDING);
    }

    public static BigDecimal div(BigDecimal a, BigDecimal b) {
        return div(a, b, SCALE);
    }

    /** a × b ÷ c with a single rounding step. */
    public static BigDecimal mulDiv(BigDecimal a, BigDecimal b, BigDecimal c, int scale) {
        return a.multiply(b).divide(c, scale, ROUNDING);
    }

    /** amount × bps ÷ 10 000. */
    public static BigDecimal bps(BigDecimal amount, int bps, int scale) {
        return mulDiv(amount, BigDecimal.valueOf(bps), BPS_DENOMINATOR, scale);
    }

    /** Converts a native integer amount with {@code decimals} places into a decimal. */
    public static BigDecimal fromUnits(BigInteger units, int decimals) {
        return new BigDecimal(units, decimals);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
