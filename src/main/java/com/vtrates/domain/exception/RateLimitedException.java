package com.vtrates.domain.exception;

/**
 * Source rejected the request because of rate limiting
 */
public class RateLimitedException extends RateSourceException {

    public RateLimitedException(String sourceName, String message) {
        super(sourceName, message, null);
    }

    public RateLimitedException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
