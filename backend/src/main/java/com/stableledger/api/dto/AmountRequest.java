package com.stableledger.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Body of mint, redeem, bond redemption and approve. Zero and negative amounts are rejected by the engine.
 */
public record AmountRequest(@NotNull(message = "INVALID_AMOUNT") BigDecimal amount) {
}
