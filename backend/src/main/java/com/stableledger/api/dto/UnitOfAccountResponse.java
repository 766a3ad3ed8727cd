package com.stableledger.api.dto;

import com.stableledger.pricing.IndexUpdate;

import java.math.BigDecimal;
import java.util.List;

public record UnitOfAccountResponse(BigDecimal current, List<IndexUpdate> history) {
}
