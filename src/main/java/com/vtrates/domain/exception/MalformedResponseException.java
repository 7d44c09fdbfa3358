package com.vtrates.domain.exception;

/**
 * Source returned a payload of unexpected shape
 */
public class MalformedResponseException extends RateSourceException {

    public MalformedResponseException(String sourceName, String message) {
        super(sourceName, message, null);
    }

    public MalformedResponseException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
