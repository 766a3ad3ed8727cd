package com.stableledger.api.dto;

import java.math.BigDecimal;

public record BalanceResponse(String asset, String account, BigDecimal balance, BigDecimal allowance) {
}
