package net.jobsy.app.web;

import net.jobsy.core.exception.InvalidScheduleException;
import net.jobsy.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Converts domain exceptions to HTTP responses. Stack traces stay in the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Job not found", ex.getMessage());
    }

    /** Stored job with a schedule that no longer parses (HTTP 422). */
    @ExceptionHandler(InvalidScheduleException.class)
    ResponseEntity<ApiError> handleInvalidSchedule(InvalidScheduleException ex) {
        log.warn("Invalid schedule '{}': {}", ex.getExpression(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Invalid cron schedule", ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Malformed request", ex.getMessage());
    }

    /**
     * Catch-all (HTTP 500). Spring's own web exceptions keep their status.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse er) {
            return respond(er.getStatusCode(), ex.getClass().getSimpleName(), "Request failed", ex.getMessage());
        }
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "See server log");
    }

    private static ResponseEntity<ApiError> respond(HttpStatusCode status, String error, String message, String detail) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ApiError(error, message, detail, Instant.now()));
    }
}
