package com.stableledger.collateral.engine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only snapshot of the global collateral position.
 */
public record PositionView(BigDecimal totalReserveUnits, BigDecimal totalStableSupplyTracked, Instant updatedAt,
                           boolean paused, String admin, String pendingAdmin) {
}
