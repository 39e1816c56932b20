package com.phillippitts.newwork.presentation.exception;

import com.phillippitts.newwork.exception.BackendStartException;
import com.phillippitts.newwork.exception.ExecutableNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the local REST API.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Executable paths and exit details are logged, never returned to the client.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Installation problem - retrying cannot help (HTTP 503).
     */
    @ExceptionHandler(ExecutableNotFoundException.class)
    ResponseEntity<ApiError> handleExecutableNotFound(ExecutableNotFoundException ex) {
        LOG.error("Backend executable not found at path: {}", ex.getExecutablePath());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Backend unavailable",
                "Backend executable is missing. Reinstall the application.",
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(BackendStartException.class)
    ResponseEntity<ApiError> handleStartFailure(BackendStartException ex) {
        LOG.error("Backend start failed: exitCode={}", ex.getExitCode(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Backend failed to start",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Client error - malformed or invalid request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Invalid request",
                "Request body is missing or invalid",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Check the application log for details",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
