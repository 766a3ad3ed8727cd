package com.stableledger.domain;

import java.math.BigInteger;

/**
 * Raw reserves of a two-asset pool in native units and the time (epoch seconds) they were last written.
 */
public record PoolReserves(BigInteger reserve0, BigInteger reserve1, long blockTimestampLast) {
}
