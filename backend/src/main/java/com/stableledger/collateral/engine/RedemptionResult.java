package com.stableledger.collateral.engine;

import java.math.BigDecimal;

/**
 * Outcome of a Stable redemption. {@code collateralRatio} is the ratio before the redemption.
 */
public record RedemptionResult(RedemptionTier tier, BigDecimal stableIn, BigDecimal fee, BigDecimal reserveOut,
                               BigDecimal bondOut, BigDecimal backstopOut, BigDecimal collateralRatio) {
}
