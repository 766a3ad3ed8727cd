package com.stableledger.collateral.engine;

import java.math.BigDecimal;

/**
 * Payout of one redemption. Amounts are in each asset's own units.
 */
public record RedemptionPlan(RedemptionTier tier, BigDecimal reserveOut, BigDecimal bondOut, BigDecimal backstopOut) {
}
