package com.stableledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Validated USD price of an asset at 18 decimals. Produced per request, never persisted.
 */
public record TrustedPrice(AssetId asset, BigDecimal value, Instant asOf) {
}
