package com.williamcallahan.gvtakeout.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body of the query API, for example
 * {@code {"status":"error","message":"No conversation with id 9"}}.
 *
 * @param status always {@code "error"}
 * @param message what went wrong, in terms of the request
 * @param details exception summary for server-side failures; omitted otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details) {

    static final String ERROR = "error";

    public ApiErrorResponse {
        status = status == null ? ERROR : status;
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Error responses need a message");
        }
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(ERROR, message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(ERROR, message, details);
    }
}
