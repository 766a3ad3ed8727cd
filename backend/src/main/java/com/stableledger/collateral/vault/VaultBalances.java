package com.stableledger.collateral.vault;

import java.math.BigDecimal;

public record VaultBalances(BigDecimal reserve, BigDecimal backstop, BigDecimal stableHeld) {
}
