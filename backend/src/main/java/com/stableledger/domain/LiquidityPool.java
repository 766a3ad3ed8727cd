package com.stableledger.domain;

import java.math.BigInteger;

/**
 * Two-asset liquidity pool exposing a cumulative price of token0 in token1.
 * The accumulator is UQ112x112 fixed point (price × 2^112) integrated over seconds.
 */
public interface LiquidityPool {

    String pairId();

    /** Accumulator as of {@link #lastSyncTime()}. Non-decreasing. */
    BigInteger cumulativePriceAccumulator();

    PoolReserves reserves();

    /** Epoch seconds of the last reserve update. */
    long lastSyncTime();

    /** Accumulator, reserves and sync time from a single read, never torn by a concurrent update. */
    PoolState state();
}
