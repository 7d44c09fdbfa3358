package com.vtrates.domain.exception;

/**
 * Source did not answer within its timeout
 */
public class SourceTimeoutException extends RateSourceException {

    public SourceTimeoutException(String sourceName, String message) {
        super(sourceName, message, null);
    }

    public SourceTimeoutException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
