package com.stableledger.api.dto;

import com.stableledger.collateral.engine.RedemptionResult;

import java.math.BigDecimal;

public record RedeemResponse(String tier, BigDecimal stableIn, BigDecimal fee, BigDecimal reserveOut,
                             BigDecimal bondOut, BigDecimal backstopOut, BigDecimal collateralRatio) {

    public static RedeemResponse from(RedemptionResult r) {
        return new RedeemResponse(r.tier().name(), r.stableIn(), r.fee(), r.reserveOut(), r.bondOut(),
                r.backstopOut(), r.collateralRatio());
    }
}
