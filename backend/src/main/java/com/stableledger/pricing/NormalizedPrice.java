package com.stableledger.pricing;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Push-feed reading normalized to 18 decimals.
 */
public record NormalizedPrice(String feedId, BigDecimal value, Instant asOf) {
}
