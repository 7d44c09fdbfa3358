package com.vtrates.domain.model;

/**
 * Outcome of one source within an update run
 */
public record SourceReport(
        String source,
        boolean success,
        int fetched,
        long elapsedMs,
        String errorType,
        String errorMessage
) {

    public static SourceReport success(String source, int fetched, long elapsedMs) {
        return new SourceReport(source, true, fetched, elapsedMs, null, null);
    }

    public static SourceReport failure(String source, long elapsedMs, Throwable error) {
        return new SourceReport(source, false, 0, elapsedMs,
                error.getClass().getSimpleName(), error.getMessage());
    }
}
