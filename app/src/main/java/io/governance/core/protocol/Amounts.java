package io.governance.core.protocol;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integer helpers for token amounts held in minor units.
 * Ratio products go through BigInteger so {@code a * b} never overflows before the division.
 */
public final class Amounts {
    private Amounts() {}

    /** floor(value * numerator / denominator). Denominator must be positive. */
    public static long multiplyRatio(long value, long numerator, long denominator) {
        if (denominator <= 0) {
            throw new ArithmeticException("denominator must be > 0");
        }
        BigInteger product = BigInteger.valueOf(value).multiply(BigInteger.valueOf(numerator));
        return product.divide(BigInteger.valueOf(denominator)).longValueExact();
    }

    public static long add(long a, long b) {
        return Math.addExact(a, b);
    }

    /** a - b, failing instead of going negative. */
    public static long subtract(long a, long b) {
        long out = Math.subtractExact(a, b);
        if (out < 0) {
            throw new ArithmeticException("underflow: " + a + " - " + b);
        }
        return out;
    }

    /** True when {@code part / whole >= ratio}, evaluated without rounding. */
    public static boolean ratioAtLeast(long part, long whole, BigDecimal ratio) {
        return BigDecimal.valueOf(part).compareTo(ratio.multiply(BigDecimal.valueOf(whole))) >= 0;
    }

    /** True when {@code part / whole > ratio}, evaluated without rounding. */
    public static boolean ratioAbove(long part, long whole, BigDecimal ratio) {
        return BigDecimal.valueOf(part).compareTo(ratio.multiply(BigDecimal.valueOf(whole))) > 0;
    }
}
