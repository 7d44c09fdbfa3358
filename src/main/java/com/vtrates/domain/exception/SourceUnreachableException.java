package com.vtrates.domain.exception;

/**
 * Source could not be reached
 */
public class SourceUnreachableException extends RateSourceException {

    public SourceUnreachableException(String sourceName, String message) {
        super(sourceName, message, null);
    }

    public SourceUnreachableException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
