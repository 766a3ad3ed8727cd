package com.stableledger.collateral.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RedemptionWaterfallTest {

    private static final BigDecimal ONE = BigDecimal.ONE;

    @Test
    @DisplayName("collateral ratio is 1 with no supply and scales with the reserve price")
    void collateralRatio() {
        assertThat(RedemptionWaterfall.collateralRatio(BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("50000"), ONE))
                .isEqualByComparingTo("1");
        assertThat(RedemptionWaterfall.collateralRatio(ONE, new BigDecimal("50000"), new BigDecimal("25000"), ONE))
                .isEqualByComparingTo("0.5");
        assertThat(RedemptionWaterfall.collateralRatio(ONE, new BigDecimal("50000"), new BigDecimal("50000"),
                new BigDecimal("1.25"))).isEqualByComparingTo("0.8");
    }

    @Test
    @DisplayName("fully backed payout converts net at the trusted price and floors to reserve decimals")
    void fullyBacked() {
        RedemptionPlan plan = RedemptionWaterfall.fullyBacked(new BigDecimal("1000"), new BigDecimal("30000"), ONE, 8);

        assertThat(plan.tier()).isEqualTo(RedemptionTier.RESERVE);
        assertThat(plan.reserveOut()).isEqualByComparingTo("0.03333333");
        assertThat(plan.bondOut()).isZero();
        assertThat(plan.backstopOut()).isZero();
    }

    @Test
    @DisplayName("unit of account above a dollar pays proportionally more reserve")
    void fullyBackedWithIndexedUnit() {
        RedemptionPlan plan = RedemptionWaterfall.fullyBacked(new BigDecimal("1000"), new BigDecimal("50000"),
                new BigDecimal("1.10"), 8);

        assertThat(plan.reserveOut()).isEqualByComparingTo("0.022");
    }

    @Test
    @DisplayName("Bond at market covers the shortfall exactly")
    void bondAtMarket() {
        BigDecimal reserveOut = RedemptionWaterfall.proRataReserve(new BigDecimal("1000"), ONE, new BigDecimal("50000"), 8);
        BigDecimal shortfall = RedemptionWaterfall.shortfall(new BigDecimal("1000"), reserveOut, new BigDecimal("25000"), ONE);
        RedemptionPlan plan = RedemptionWaterfall.withBond(reserveOut, shortfall, new BigDecimal("1.25"));

        assertThat(shortfall).isEqualByComparingTo("500");
        assertThat(plan.bondOut()).isEqualByComparingTo("400");
        assertThat(plan.bondOut().multiply(new BigDecimal("1.25"))).isEqualByComparingTo(shortfall);
    }

    @Test
    @DisplayName("below the floor, Bond at the floor plus Backstop at market equals the shortfall")
    void backstopTier() {
        BigDecimal shortfall = new BigDecimal("500");
        BigDecimal floor = new BigDecimal("0.98");
        RedemptionPlan plan = RedemptionWaterfall.withBackstop(BigDecimal.ZERO, shortfall, new BigDecimal("0.49"), floor,
                new BigDecimal("4"));

        assertThat(plan.tier()).isEqualTo(RedemptionTier.RESERVE_BOND_AND_BACKSTOP);
        assertThat(plan.bondOut().multiply(floor)).isCloseTo(new BigDecimal("250"), within(new BigDecimal("1e-15")));
        assertThat(plan.backstopOut()).isEqualByComparingTo("62.5");
        assertThat(plan.bondOut().multiply(floor).add(plan.backstopOut().multiply(new BigDecimal("4"))))
                .isCloseTo(shortfall, within(new BigDecimal("1e-15")));
    }
}
