package com.vtrates.domain.exception;

/**
 * Base class for all rate service failures
 */
public class RateServiceException extends RuntimeException {

    public RateServiceException(String message) {
        super(message);
    }

    public RateServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
