package com.phillippitts.graphicrecorder.presentation.exception;

import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for the HTTP endpoints.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error (HTTP 400). Missing resources map to 404, oversized uploads and reports
     * to 413, and a wrong audio content type to 415.
     */
    @ExceptionHandler(DomainException.class)
    ResponseEntity<ApiError> handleDomain(DomainException ex) {
        HttpStatus status = statusOf(ex.getCode());
        LOG.debug("Request rejected: code={}, status={}", ex.getCode(), status.value());
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getCode().name(),
                ex.getMessage(),
                null,
                Instant.now()
            ));
    }

    /**
     * Malformed path variable such as a non-numeric media id (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.debug("Invalid request parameter: {}", ex.getName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidParameter",
                "Invalid request parameter",
                ex.getName(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOG.error("Storage failure: operation={}", ex.getOperation(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Storage temporarily unavailable",
                "Please retry in a few seconds",
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
                null,
                Instant.now()
            ));
    }

    private static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case MEETING_NOT_FOUND, MEDIA_NOT_FOUND, SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AUDIO_UPLOAD_TOO_LARGE, REPORT_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case UNSUPPORTED_AUDIO_TYPE -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            default -> HttpStatus.BAD_REQUEST;
        };
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
