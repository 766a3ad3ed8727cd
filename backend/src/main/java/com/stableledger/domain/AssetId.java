package com.stableledger.domain;

/**
 * Assets the protocol prices and moves.
 */
public enum AssetId {
    /** BTC collateral locked to mint Stable. */
    RESERVE,
    STABLE,
    BOND,
    BACKSTOP
}
