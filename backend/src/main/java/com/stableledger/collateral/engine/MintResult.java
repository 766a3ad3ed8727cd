package com.stableledger.collateral.engine;

import java.math.BigDecimal;

/**
 * @param stableMinted total Stable issued (to the caller plus the fee)
 * @param stableToCaller net amount credited to the caller
 * @param fee Stable minted to the vault
 */
public record MintResult(BigDecimal reserveIn, BigDecimal stableMinted, BigDecimal stableToCaller, BigDecimal fee,
                         BigDecimal reservePrice, BigDecimal unitOfAccountPrice) {
}
