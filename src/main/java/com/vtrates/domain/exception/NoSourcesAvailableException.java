package com.vtrates.domain.exception;

/**
 * Every selected source failed, so the run produced nothing
 */
public class NoSourcesAvailableException extends RateServiceException {

    public NoSourcesAvailableException(String message) {
        super(message);
    }
}
