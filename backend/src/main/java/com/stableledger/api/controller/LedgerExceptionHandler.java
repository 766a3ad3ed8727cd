package com.stableledger.api.controller;

import com.stableledger.api.dto.ErrorBody;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.governance.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ledger failures to HTTP statuses. Every such failure has already been rolled back.
 */
@RestControllerAdvice
@Slf4j
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorBody> handleLedger(LedgerException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        log.debug("Ledger request failed with {}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<ErrorBody> handleInvalidParameter(InvalidParameterException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PARAMETER", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    static HttpStatus statusOf(LedgerErrorCode code) {
        return switch (code) {
            case ZERO_AMOUNT -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS, INSUFFICIENT_ALLOWANCE, REDEMPTION_CAP_EXCEEDED, REENTRANT_CALL -> HttpStatus.CONFLICT;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case PAUSED -> HttpStatus.LOCKED;
            case PRICE_DEVIATION, OBSERVATION_NOT_READY, PRICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
