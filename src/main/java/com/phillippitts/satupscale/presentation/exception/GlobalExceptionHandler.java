package com.phillippitts.satupscale.presentation.exception;

import com.phillippitts.satupscale.exception.InputNotFoundException;
import com.phillippitts.satupscale.exception.JobNotFoundException;
import com.phillippitts.satupscale.exception.ModelInvocationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - selected input missing (HTTP 400).
     */
    @ExceptionHandler(InputNotFoundException.class)
    ResponseEntity<ApiError> handleInputNotFound(InputNotFoundException ex) {
        LOG.warn("Input not found: {}", ex.getInputPath());
        return error(HttpStatus.BAD_REQUEST, ex.getErrorCode(), "Input not found", ex.getMessage());
    }

    /**
     * Client error - invalid request (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Request validation failed", details);
    }

    /**
     * Unknown job id (HTTP 404).
     */
    @ExceptionHandler(JobNotFoundException.class)
    ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
        LOG.debug("Job not found: {}", ex.getJobId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Job not found", ex.getMessage());
    }

    /**
     * Queue misuse, e.g. submit after shutdown or cancelling a finished job (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Conflict", "Request conflicts with job state", ex.getMessage());
    }

    /**
     * Transient error - model runtime unavailable (HTTP 503).
     */
    @ExceptionHandler(ModelInvocationException.class)
    ResponseEntity<ApiError> handleModelFailure(ModelInvocationException ex) {
        LOG.error("Model invocation failed: model={}", ex.getModelName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ModelInvocationException.ERROR_CODE,
                "Upscale model temporarily unavailable", "Please retry later");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
