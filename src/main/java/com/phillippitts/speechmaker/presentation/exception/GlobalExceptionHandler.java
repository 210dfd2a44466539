package com.phillippitts.speechmaker.presentation.exception;

import com.phillippitts.speechmaker.domain.ErrorCategory;
import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.exception.ClassifiedException;
import com.phillippitts.speechmaker.exception.NotReadyException;
import com.phillippitts.speechmaker.exception.SpeechMakerException;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API boundary.
 *
 * <p>Classified failures are returned as their {@link ErrorRecord}, with an HTTP status derived
 * from the category. Everything else becomes an {@link ApiError}; unexpected errors are classified
 * (UNKNOWN) so they show up in diagnostics, and their details stay in the logs.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    private final ErrorClassifier classifier;

    GlobalExceptionHandler(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    @ExceptionHandler(ClassifiedException.class)
    ResponseEntity<ErrorRecord> handleClassified(ClassifiedException ex) {
        ErrorRecord record = ex.getRecord();
        HttpStatus status = statusFor(record.category());
        LOG.warn("Request failed: category={}, code={}, status={}", record.category(), record.code(), status.value());
        return ResponseEntity.status(status).body(record);
    }

    /**
     * Not ready yet (initializing, no voices, no folder) - HTTP 409.
     */
    @ExceptionHandler(NotReadyException.class)
    ResponseEntity<ApiError> handleNotReady(NotReadyException ex) {
        LOG.info("Rejected while not ready: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(ex.getErrorCode(), "Not ready to convert", ex.getMessage(), Instant.now()));
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .collect(Collectors.joining("; "));
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("VALIDATION_FAILED", "Invalid request", details, Instant.now()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        String details = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("BAD_REQUEST", "Invalid request", details, Instant.now()));
    }

    /**
     * Operation not allowed in the session's current state (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleConflict(IllegalStateException ex) {
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError("CONFLICT", "Operation not allowed now", ex.getMessage(), Instant.now()));
    }

    /**
     * Unclassified application failure, e.g. an output folder that cannot be created.
     */
    @ExceptionHandler(SpeechMakerException.class)
    ResponseEntity<ErrorRecord> handleApplication(SpeechMakerException ex) {
        ErrorRecord record = classifier.classify(ex, ErrorContext.of(ErrorContext.CONVERT));
        return ResponseEntity.status(statusFor(record.category())).body(record);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        ErrorRecord record = classifier.classify(ex, ErrorContext.of(ErrorContext.CONVERT));
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with error ID " + record.id(),
                Instant.now()
            ));
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case EMPTY_INPUT, UNSUPPORTED_FILE_TYPE, FILE_TOO_LARGE, IS_DIRECTORY -> HttpStatus.BAD_REQUEST;
            case FILE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case VOICE_UNAVAILABLE, CONVERTER_MISSING, OUTPUT_LOCATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CANCELLED -> HttpStatus.CONFLICT;
            case ENGINE_UNRESPONSIVE, TOO_MANY_OPEN_FILES -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
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
