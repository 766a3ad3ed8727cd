package com.stableledger.collateral.engine;

import com.stableledger.common.FixedPoint;

import java.math.BigDecimal;

/**
 * Payout arithmetic of the three-tier redemption waterfall. Values are in units of account unless
 * stated otherwise; every division rounds down.
 */
final class RedemptionWaterfall {

    private RedemptionWaterfall() {
    }

    /**
     * (reserve × reservePrice) / (supply × unitOfAccountPrice). An empty position counts as fully backed.
     */
    static BigDecimal collateralRatio(BigDecimal totalReserveUnits, BigDecimal totalStableSupply,
                                      BigDecimal reservePrice, BigDecimal unitOfAccountPrice) {
        if (totalStableSupply.signum() == 0) {
            return FixedPoint.ONE;
        }
        return FixedPoint.div(totalReserveUnits.multiply(reservePrice),
                totalStableSupply.multiply(unitOfAccountPrice));
    }

    /** Tier 1: {@code net} converted to reserve at the trusted price. */
    static RedemptionPlan fullyBacked(BigDecimal net, BigDecimal reservePrice, BigDecimal unitOfAccountPrice,
                                      int reserveDecimals) {
        BigDecimal reserveOut = FixedPoint.mulDiv(net, unitOfAccountPrice, reservePrice, reserveDecimals);
        return new RedemptionPlan(RedemptionTier.RESERVE, reserveOut, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /** Pro-rata reserve share paid in an under-collateralized redemption. */
    static BigDecimal proRataReserve(BigDecimal net, BigDecimal totalReserveUnits, BigDecimal totalStableSupply,
                                     int reserveDecimals) {
        return FixedPoint.mulDiv(net, totalReserveUnits, totalStableSupply, reserveDecimals);
    }

    /** Units of account still owed after the reserve payout. */
    static BigDecimal shortfall(BigDecimal net, BigDecimal reserveOut, BigDecimal reservePrice,
                                BigDecimal unitOfAccountPrice) {
        BigDecimal reserveValue = FixedPoint.mulDiv(reserveOut, reservePrice, unitOfAccountPrice, FixedPoint.SCALE);
        return net.subtract(reserveValue).max(BigDecimal.ZERO);
    }

    /** Tier 2: shortfall paid in Bond at its market price (units of account). */
    static RedemptionPlan withBond(BigDecimal reserveOut, BigDecimal shortfall, BigDecimal bondPrice) {
        BigDecimal bondOut = FixedPoint.div(shortfall, bondPrice);
        return new RedemptionPlan(RedemptionTier.RESERVE_AND_BOND, reserveOut, bondOut, BigDecimal.ZERO);
    }

    /**
     * Tier 3: Bond trades below its floor. The part of the shortfall Bond can cover is
     * shortfall × bondPrice / floor, issued at the floor price; the rest is paid in Backstop at market.
     */
    static RedemptionPlan withBackstop(BigDecimal reserveOut, BigDecimal shortfall, BigDecimal bondPrice,
                                       BigDecimal bondFloor, BigDecimal backstopPrice) {
        BigDecimal coveredByBond = FixedPoint.mulDiv(shortfall, bondPrice, bondFloor, FixedPoint.SCALE);
        BigDecimal bondOut = FixedPoint.div(coveredByBond, bondFloor);
        BigDecimal backstopOut = FixedPoint.div(shortfall.subtract(coveredByBond), backstopPrice);
        return new RedemptionPlan(RedemptionTier.RESERVE_BOND_AND_BACKSTOP, reserveOut, bondOut, backstopOut);
    }
}
