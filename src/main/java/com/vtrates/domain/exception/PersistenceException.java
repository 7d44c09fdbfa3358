package com.vtrates.domain.exception;

/**
 * Reading or writing the rate cache files failed
 */
public class PersistenceException extends RateServiceException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
