package com.stableledger.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AdminTransferRequest(@NotBlank(message = "INVALID_ACCOUNT") String candidate) {
}
