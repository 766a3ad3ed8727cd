package com.stableledger.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Raw push-feed answer: {@code answer} carries {@code decimals} implied decimal places.
 */
public record FeedReading(BigInteger answer, int decimals, Instant asOf) {
}
