package com.stableledger.api.dto;

import java.math.BigDecimal;

public record RatioResponse(BigDecimal collateralRatio) {
}
