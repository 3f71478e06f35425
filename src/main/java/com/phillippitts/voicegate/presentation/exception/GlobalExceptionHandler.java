package com.phillippitts.voicegate.presentation.exception;

import com.phillippitts.voicegate.exception.InvalidIdentityException;
import com.phillippitts.voicegate.exception.ProviderRequestException;
import com.phillippitts.voicegate.exception.ProviderUnavailableException;
import com.phillippitts.voicegate.exception.SessionNotFoundException;
import com.phillippitts.voicegate.exception.SessionStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting storage and provider details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - no usable identity (HTTP 400).
     */
    @ExceptionHandler(InvalidIdentityException.class)
    ResponseEntity<ApiError> handleInvalidIdentity(InvalidIdentityException ex) {
        LOG.warn("Rejected request without usable identity: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Unable to identify client", ex.getReason());
    }

    /**
     * Client error - malformed body, parameter or enum value (HTTP 400).
     */
    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Unknown session: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Session not found", "No session " + ex.getSessionId());
    }

    /**
     * Transient error - retry possible (HTTP 503). The admission lock was already released.
     */
    @ExceptionHandler(ProviderUnavailableException.class)
    ResponseEntity<ApiError> handleProviderUnavailable(ProviderUnavailableException ex) {
        LOG.error("Speech provider unavailable after {} attempts", ex.getAttempts(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Voice service temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Provider refused the credential request. Configuration problem on our side, so the client
     * gets a generic 503.
     */
    @ExceptionHandler(ProviderRequestException.class)
    ResponseEntity<ApiError> handleProviderRejected(ProviderRequestException ex) {
        LOG.error("Speech provider rejected credential request: status={}", ex.getStatusCode(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Voice service temporarily unavailable", "Contact administrator if this persists");
    }

    @ExceptionHandler(SessionStoreException.class)
    ResponseEntity<ApiError> handleStore(SessionStoreException ex) {
        LOG.error("Session store failure during {}", ex.getOperation(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Session storage temporarily unavailable", "Please retry in a few seconds");
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
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
