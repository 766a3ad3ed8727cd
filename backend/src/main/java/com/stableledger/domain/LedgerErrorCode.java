package com.stableledger.domain;

/**
 * Failure taxonomy shared by engine, vault and oracles. API layer maps each code to an HTTP status.
 */
public enum LedgerErrorCode {
    ZERO_AMOUNT,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_ALLOWANCE,
    UNAUTHORIZED,
    PAUSED,
    PRICE_DEVIATION,
    OBSERVATION_NOT_READY,
    REENTRANT_CALL,
    REDEMPTION_CAP_EXCEEDED,
    /** Missing, unknown or stale feed or route. */
    PRICE_UNAVAILABLE
}
