package com.campost.faraid.util;

import org.apache.commons.math3.fraction.BigFraction;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Divides a pool of parts among members in proportion to a weight. Used for shared fixed
 * shares (equal weights), residue (2 for males, 1 for females) and Radd (existing parts).
 */
public final class ShareAllocator {

    private ShareAllocator() {
    }

    public static <T> Map<T, BigFraction> equally(BigFraction pool, Collection<T> members) {
        return byWeight(pool, members, member -> 1);
    }

    public static <T> Map<T, BigFraction> byWeight(BigFraction pool, Collection<T> members, ToIntFunction<T> weight) {
        return byFractionWeight(pool, members, member -> new BigFraction(weight.applyAsInt(member)));
    }

    public static <T> Map<T, BigFraction> byFractionWeight(BigFraction pool, Collection<T> members,
                                                          Function<T, BigFraction> weight) {
        Map<T, BigFraction> allocation = new LinkedHashMap<>();
        BigFraction totalWeight = BigFraction.ZERO;
        for (T member : members) {
            BigFraction w = weight.apply(member);
            if (Parts.signum(w) < 0) {
                throw new IllegalArgumentException("Negative weight for " + member);
            }
            totalWeight = totalWeight.add(w);
        }
        if (Parts.isZero(totalWeight)) {
            return allocation;
        }
        for (T member : members) {
            allocation.put(member, pool.multiply(weight.apply(member)).divide(totalWeight));
        }
        return allocation;
    }
}
