package com.stableledger.collateral.engine;

import java.math.BigDecimal;

public record BondRedemptionResult(BigDecimal bondIn, BigDecimal stableOut, BigDecimal remainingCap) {
}
