package com.stableledger.collateral.engine;

public enum RedemptionTier {
    /** Fully backed: reserve at the trusted price. */
    RESERVE,
    /** Under-collateralized: pro-rata reserve, shortfall in Bond at market. */
    RESERVE_AND_BOND,
    /** Under-collateralized with Bond below its floor: Bond at the floor, residual in Backstop. */
    RESERVE_BOND_AND_BACKSTOP
}
