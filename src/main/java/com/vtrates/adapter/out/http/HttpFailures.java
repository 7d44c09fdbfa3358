package com.vtrates.adapter.out.http;

import com.vtrates.domain.exception.MalformedResponseException;
import com.vtrates.domain.exception.RateLimitedException;
import com.vtrates.domain.exception.RateSourceException;
import com.vtrates.domain.exception.SourceTimeoutException;
import com.vtrates.domain.exception.SourceUnreachableException;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;

import java.util.concurrent.TimeoutException;

/**
 * Maps HTTP client failures and status codes to source exceptions
 */
final class HttpFailures {

    private HttpFailures() {
    }

    static RateSourceException classify(String sourceName, Throwable error) {
        if (error instanceof RateSourceException sourceError) {
            return sourceError;
        }
        if (error instanceof TimeoutException
                || (error.getMessage() != null && error.getMessage().toLowerCase().contains("timeout"))) {
            return new SourceTimeoutException(sourceName, "request timed out", error);
        }
        return new SourceUnreachableException(sourceName, String.valueOf(error.getMessage()), error);
    }

    /**
     * @return null when the status is 2xx
     */
    static RateSourceException checkStatus(String sourceName, HttpResponse<Buffer> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return null;
        }
        if (status == 429) {
            return new RateLimitedException(sourceName, "HTTP 429 Too Many Requests");
        }
        if (status >= 500) {
            return new SourceUnreachableException(sourceName, "HTTP " + status);
        }
        return new MalformedResponseException(sourceName, "unexpected HTTP status " + status);
    }
}
