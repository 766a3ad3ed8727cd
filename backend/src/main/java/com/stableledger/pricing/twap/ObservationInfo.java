package com.stableledger.pricing.twap;

/**
 * Readiness view of one pair for the health surface. Timestamps are epoch seconds, null when the slot is empty.
 */
public record ObservationInfo(
        String pairId,
        Long olderTimestamp,
        Long newerTimestamp,
        Long secondsSinceNewer,
        boolean ready,
        boolean needsUpdate
) {
}
