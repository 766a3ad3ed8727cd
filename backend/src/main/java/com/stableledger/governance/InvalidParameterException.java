package com.stableledger.governance;

import lombok.Getter;

/**
 * Thrown when a parameter write is outside its accepted range.
 */
@Getter
public class InvalidParameterException extends RuntimeException {

    private final ParamType param;

    public InvalidParameterException(ParamType param, String message) {
        super(message);
        this.param = param;
    }
}
