package com.campost.faraid.Entity.Enum;

import lombok.Getter;
import org.apache.commons.math3.fraction.BigFraction;

@Getter
public enum FixedShare {
    HALF(1, 2),
    QUARTER(1, 4),
    EIGHTH(1, 8),
    TWO_THIRDS(2, 3),
    THIRD(1, 3),
    SIXTH(1, 6);

    public static final int BASE = 24;

    private final int numerator;
    private final int denominator;

    FixedShare(int numerator, int denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /** Parts of this share out of the base of 24. */
    public BigFraction getParts() {
        return new BigFraction(BASE * numerator, denominator);
    }

    public String getLabel() {
        return numerator + "/" + denominator;
    }
}
