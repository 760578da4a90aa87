package com.campost.faraid.util;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShareAllocatorTest {

    @Test
    void splitsPoolEqually() {
        Map<String, BigFraction> allocation = ShareAllocator.equally(new BigFraction(3), List.of("wife 1", "wife 2"));

        assertThat(allocation).containsEntry("wife 1", new BigFraction(3, 2))
                .containsEntry("wife 2", new BigFraction(3, 2));
    }

    @Test
    void weightsMalesTwiceFemales() {
        Map<String, BigFraction> allocation = ShareAllocator.byWeight(
                new BigFraction(17), List.of("son", "daughter"), m -> m.equals("son") ? 2 : 1);

        assertThat(allocation.get("son")).isEqualTo(new BigFraction(34, 3));
        assertThat(allocation.get("daughter")).isEqualTo(new BigFraction(17, 3));
        assertThat(allocation.values().stream().reduce(BigFraction.ZERO, BigFraction::add)).isEqualTo(new BigFraction(17));
    }

    @Test
    void weightsByExistingShares() {
        Map<String, BigFraction> allocation = ShareAllocator.byFractionWeight(
                new BigFraction(8), List.of("mother", "daughter"),
                m -> m.equals("mother") ? new BigFraction(4) : new BigFraction(12));

        assertThat(allocation).containsEntry("mother", new BigFraction(2))
                .containsEntry("daughter", new BigFraction(6));
    }

    @Test
    void returnsNothingWhenAllWeightsAreZero() {
        assertThat(ShareAllocator.byWeight(new BigFraction(5), List.of("a", "b"), m -> 0)).isEmpty();
    }
}
