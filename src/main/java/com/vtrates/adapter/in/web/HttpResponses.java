package com.vtrates.adapter.in.web;

import com.vtrates.adapter.in.web.dto.ErrorResponse;
import com.vtrates.domain.exception.CurrencyNotFoundException;
import com.vtrates.domain.exception.NoSourcesAvailableException;
import com.vtrates.domain.exception.RateNotFoundException;
import com.vtrates.domain.exception.RateOutOfBoundsException;
import com.vtrates.domain.exception.StaleRateException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON response writing and exception to status mapping shared by the handlers
 */
@Slf4j
public final class HttpResponses {

    private HttpResponses() {
    }

    public static int statusFor(Throwable error) {
        if (error instanceof IllegalArgumentException || error instanceof CurrencyNotFoundException) {
            return 400;
        }
        if (error instanceof RateNotFoundException) {
            return 404;
        }
        // the cached rate exists but may not be used
        if (error instanceof StaleRateException || error instanceof RateOutOfBoundsException) {
            return 409;
        }
        if (error instanceof NoSourcesAvailableException) {
            return 503;
        }
        return 500;
    }

    public static void sendJson(RoutingContext context, int statusCode, Object body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(body).encode());
    }

    public static void sendError(RoutingContext context, int statusCode, String message) {
        sendJson(context, statusCode, ErrorResponse.error(message));
    }

    public static void sendFailure(RoutingContext context, Throwable error) {
        int statusCode = statusFor(error);
        if (statusCode >= 500) {
            log.error("Request {} {} failed", context.request().method(), context.request().path(), error);
        } else {
            log.warn("Request {} {} rejected: {}", context.request().method(), context.request().path(),
                    error.getMessage());
        }
        sendError(context, statusCode, error.getMessage());
    }

    /**
     * @return null when the parameter is absent or blank
     */
    public static Integer intParam(RoutingContext context, String name) {
        String value = context.request().getParam(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must be an integer: " + value, e);
        }
    }

    public static String stringParam(RoutingContext context, String name) {
        String value = context.request().getParam(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
