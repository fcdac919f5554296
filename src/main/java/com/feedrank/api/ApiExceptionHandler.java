package com.feedrank.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps feed API failures to {@code {error_code, message, timestamp}} bodies.
 *
 * Unknown viewers and posts are 404, a re-submitted post id is 409, and malformed
 * JSON, unknown enum values or rejected ranking settings are 400. The ranking engine
 * itself does not throw, so a 500 here means a bug in the service layer.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FeedResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(FeedResourceNotFoundException ex) {
        log.debug("Lookup miss [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return errorBody(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(DuplicatePostException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicatePost(DuplicatePostException ex) {
        log.warn("Rejected post re-submission: {}", ex.getMessage());
        return errorBody("DUPLICATE_POST", ex.getMessage());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableRequest(Exception ex) {
        log.debug("Unreadable feed request", ex);
        return errorBody("BAD_REQUEST", "malformed post, viewer or ranking payload: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleRejectedInput(IllegalArgumentException ex) {
        log.info("Rejected feed input: {}", ex.getMessage());
        return errorBody("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Feed request failed", ex);
        return errorBody("INTERNAL_ERROR", "feed request failed");
    }

    private static Map<String, Object> errorBody(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
