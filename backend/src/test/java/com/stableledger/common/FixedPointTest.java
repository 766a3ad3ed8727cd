package com.stableledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FixedPointTest {

    @Test
    @DisplayName("division floors at 18 decimals")
    void divisionFloors() {
        assertThat(FixedPoint.div(BigDecimal.ONE, new BigDecimal("3")))
                .isEqualTo(new BigDecimal("0.333333333333333333"));
        assertThat(FixedPoint.div(new BigDecimal("-1"), new BigDecimal("3")))
                .isEqualTo(new BigDecimal("-0.333333333333333334"));
    }

    @Test
    @DisplayName("mulDiv rounds once at the target scale")
    void mulDivSingleRounding() {
        assertThat(FixedPoint.mulDiv(new BigDecimal("2"), new BigDecimal("1"), new BigDecimal("3"), 8))
                .isEqualTo(new BigDecimal("0.66666666"));
    }

    @Test
    @DisplayName("bps takes a basis-point share")
    void bps() {
        assertThat(FixedPoint.bps(new BigDecimal("50000"), 50, 18)).isEqualByComparingTo("250");
        assertThat(FixedPoint.bps(new BigDecimal("1"), 0, 18)).isZero();
    }

    @Test
    @DisplayName("native units convert with their decimals")
    void fromUnits() {
        assertThat(FixedPoint.fromUnits(BigInteger.valueOf(150_000_000L), 8)).isEqualByComparingTo("1.5");
    }
}
