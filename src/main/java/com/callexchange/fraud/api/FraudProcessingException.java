package com.callexchange.fraud.api;

/**
 * Internal failure the caller must know about (e.g. a fraud report could not be stored).
 */
public class FraudProcessingException extends RuntimeException {

    public FraudProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
