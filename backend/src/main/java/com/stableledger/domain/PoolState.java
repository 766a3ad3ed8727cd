package com.stableledger.domain;

import java.math.BigInteger;

/**
 * Accumulator and reserves of a pool read together; the accumulator is as of
 * {@code reserves.blockTimestampLast()}.
 */
public record PoolState(BigInteger cumulativePriceAccumulator, PoolReserves reserves) {
}
