package com.stableledger.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record ParamUpdateRequest(@NotNull(message = "INVALID_PARAMETER") BigDecimal value) {
}
