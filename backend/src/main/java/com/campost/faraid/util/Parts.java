package com.campost.faraid.util;

import com.campost.faraid.Entity.Enum.FixedShare;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Helpers for share parts held as {@link BigFraction} out of the base of 24.
 */
public final class Parts {

    public static final BigFraction BASE = new BigFraction(FixedShare.BASE);

    private Parts() {
    }

    public static BigFraction sum(Collection<BigFraction> values) {
        return values.stream().reduce(BigFraction.ZERO, BigFraction::add);
    }

    public static int signum(BigFraction parts) {
        return parts.getNumerator().signum();
    }

    public static boolean isZero(BigFraction parts) {
        return signum(parts) == 0;
    }

    public static boolean isWhole(BigFraction parts) {
        return parts.getDenominator().equals(BigInteger.ONE);
    }

    public static int toIntExact(BigFraction parts) {
        if (!isWhole(parts)) {
            throw new ArithmeticException(format(parts) + " is not a whole number of parts");
        }
        return parts.getNumerator().intValueExact();
    }

    public static BigDecimal toBigDecimal(BigFraction parts, int scale, RoundingMode roundingMode) {
        return new BigDecimal(parts.getNumerator())
                .divide(new BigDecimal(parts.getDenominator()), scale, roundingMode);
    }

    /** "n" for whole parts, "n/d" otherwise. */
    public static String format(BigFraction parts) {
        return isWhole(parts)
                ? parts.getNumerator().toString()
                : parts.getNumerator() + "/" + parts.getDenominator();
    }
}
