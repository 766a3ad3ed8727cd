package com.stableledger.api.dto;

import com.stableledger.collateral.engine.MintResult;

import java.math.BigDecimal;

public record MintResponse(BigDecimal reserveIn, BigDecimal stableToCaller, BigDecimal fee, BigDecimal reservePrice,
                           BigDecimal unitOfAccountPrice) {

    public static MintResponse from(MintResult r) {
        return new MintResponse(r.reserveIn(), r.stableToCaller(), r.fee(), r.reservePrice(), r.unitOfAccountPrice());
    }
}
