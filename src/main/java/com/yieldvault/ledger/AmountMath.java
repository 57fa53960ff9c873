package com.yieldvault.ledger;

import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Integer arithmetic on wei amounts.
 *
 * <p>All rates are basis points over {@link #BPS}. Every division takes an explicit
 * {@link RoundingMode}: {@link RoundingMode#DOWN} for amounts paid out of the pool,
 * {@link RoundingMode#UP} for amounts charged to a user.
 */
public final class AmountMath {

    public static final int BPS = 10_000;
    public static final BigInteger BPS_BI = BigInteger.valueOf(BPS);
    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;
    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private AmountMath() {}

    /** {@code a * b / c} with the requested rounding. Only DOWN and UP are supported. */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c, RoundingMode rounding) {
        if (c.signum() == 0) {
            throw new ArithmeticException("mulDiv by zero");
        }
        BigInteger[] qr = a.multiply(b).divideAndRemainder(c);
        if (rounding == RoundingMode.UP && qr[1].signum() != 0) {
            return qr[0].add(BigInteger.ONE);
        }
        if (rounding != RoundingMode.UP && rounding != RoundingMode.DOWN) {
            throw new IllegalArgumentException("Unsupported rounding " + rounding);
        }
        return qr[0];
    }

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c) {
        return mulDiv(a, b, c, RoundingMode.DOWN);
    }

    /** {@code amount * bps / BPS}. */
    public static BigInteger bps(BigInteger amount, long bps, RoundingMode rounding) {
        return mulDiv(amount, BigInteger.valueOf(bps), BPS_BI, rounding);
    }

    /** Lower bound after subtracting a slippage tolerance: {@code amount * (BPS - toleranceBps) / BPS}. */
    public static BigInteger floor(BigInteger amount, long toleranceBps) {
        long kept = Math.max(0, BPS - toleranceBps);
        return bps(amount, kept, RoundingMode.DOWN);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** {@code max(0, a - b)}. */
    public static BigInteger subFloor(BigInteger a, BigInteger b) {
        BigInteger diff = a.subtract(b);
        return diff.signum() < 0 ? BigInteger.ZERO : diff;
    }

    public static boolean isPositive(BigInteger value) {
        return value != null && value.signum() > 0;
    }

    public static BigInteger orZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
