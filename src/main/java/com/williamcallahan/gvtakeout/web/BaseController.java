package com.williamcallahan.gvtakeout.web;

import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Shared error mapping for the read-only query controllers.
 *
 * <p>Malformed keys and parameters become 400, absent rows 404 and store failures 500. The
 * handlers are inherited, so subclasses only name the query they serve.</p>
 */
public abstract class BaseController {
    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Short description of what this controller reads, used in 500 messages ("Failed to ...").
     */
    protected abstract String queryDescription();

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidRequest(IllegalArgumentException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiErrorResponse> handleMissing(NoSuchElementException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleStoreFailure(DataAccessException e) {
        log.error("Failed to {}: {}", queryDescription(), e.getMessage(), e);
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + queryDescription(), e);
    }
}
