package com.vtrates.domain.exception;

/**
 * Failure of a single external rate source.
 * Never fatal to an update run on its own.
 */
public abstract class RateSourceException extends RateServiceException {

    private final String sourceName;

    protected RateSourceException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Whether another attempt against the same source may succeed
     */
    public abstract boolean isRetryable();
}
