package com.stableledger.domain;

import java.math.BigDecimal;

/**
 * Governable protocol parameters. Read-only from the engine's side.
 */
public interface GovernanceParameters {

    int mintFeeBps();

    int redeemFeeBps();

    /** Minimum bond price in units of account, 18 decimals, in (0, 1]. */
    BigDecimal bondFloorPrice();

    int maxBondRate();

    int deviationToleranceBps();

    /** All parameters as of this call; later writes do not show through. */
    default GovernanceParameters snapshot() {
        return this;
    }
}
