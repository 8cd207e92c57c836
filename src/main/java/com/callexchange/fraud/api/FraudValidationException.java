package com.callexchange.fraud.api;

import lombok.Getter;

/**
 * Malformed input rejected before any collaborator is called. {@code code} is stable and machine-readable,
 * e.g. {@code INVALID_CALL} or {@code INVALID_RULES}.
 */
@Getter
public class FraudValidationException extends RuntimeException {

    private final String code;

    public FraudValidationException(String code, String message) {
        super(message);
        this.code = code;
    }
}
