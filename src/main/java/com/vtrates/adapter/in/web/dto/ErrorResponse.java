package com.vtrates.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body returned by every endpoint
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String status,
        String message,
        List<String> errors
) {
    public static ErrorResponse error(String message) {
        return new ErrorResponse("error", message, null);
    }

    public static ErrorResponse error(String message, List<String> errors) {
        return new ErrorResponse("error", message, errors);
    }
}
