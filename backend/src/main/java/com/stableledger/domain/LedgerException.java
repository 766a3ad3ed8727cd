package com.stableledger.domain;

import lombok.Getter;

/**
 * Thrown when a ledger request cannot complete. The request is aborted as a whole; callers may retry.
 * API layer (LedgerExceptionHandler) maps the code to a status.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
