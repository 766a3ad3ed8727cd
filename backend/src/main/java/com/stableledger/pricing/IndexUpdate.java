package com.stableledger.pricing;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One refresh of the unit-of-account index.
 */
public record IndexUpdate(Instant timestamp, BigDecimal value, BigDecimal pce) {
}
