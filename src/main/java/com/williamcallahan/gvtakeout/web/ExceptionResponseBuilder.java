package com.williamcallahan.gvtakeout.web;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Turns failures into {@link ApiErrorResponse} entities.
 */
@Component
public class ExceptionResponseBuilder {

    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error entity whose details name the most specific cause of {@code exception}.
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes the innermost cause as {@code SimpleName: message}; SQLite driver errors carry the
     * useful text there rather than on the Spring wrapper.
     *
     * @return description, or null when {@code exception} is null
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(exception);
        String type = cause.getClass().getSimpleName();
        String message = cause.getMessage();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
