package com.campost.faraid.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartsTest {

    record Holder(@JsonSerialize(using = BigFractionSerializer.class) BigFraction parts) {
    }

    @Test
    void formatsWholeAndFractionalParts() {
        assertThat(Parts.format(new BigFraction(18))).isEqualTo("18");
        assertThat(Parts.format(new BigFraction(70, 4))).isEqualTo("35/2");
    }

    @Test
    void sumsExactly() {
        BigFraction third = new BigFraction(1, 3);

        assertThat(Parts.sum(List.of(third, third, third))).isEqualTo(BigFraction.ONE);
        assertThat(Parts.sum(List.of())).isEqualTo(BigFraction.ZERO);
    }

    @Test
    void wholePartsOnlyConvertToInt() {
        assertThat(Parts.toIntExact(new BigFraction(56, 2))).isEqualTo(28);
        assertThatThrownBy(() -> Parts.toIntExact(new BigFraction(1, 2))).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void convertsToBigDecimal() {
        assertThat(Parts.toBigDecimal(new BigFraction(2, 3), 4, RoundingMode.HALF_UP))
                .isEqualTo(new BigDecimal("0.6667"));
    }

    @Test
    void signOfParts() {
        assertThat(Parts.signum(new BigFraction(-1, 4))).isNegative();
        assertThat(Parts.isZero(BigFraction.ZERO)).isTrue();
    }

    @Test
    void serializesAsLabel() throws Exception {
        String json = new ObjectMapper().writeValueAsString(new Holder(new BigFraction(63, 4)));

        assertThat(json).isEqualTo("{\"parts\":\"63/4\"}");
    }
}
