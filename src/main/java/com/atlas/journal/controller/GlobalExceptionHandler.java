package com.atlas.journal.controller;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.atlas.journal.exception.CurationInProgressException;
import com.atlas.journal.exception.DeviceReportingUnavailableException;
import com.atlas.journal.exception.InvalidCoordinateException;
import com.atlas.journal.exception.NoActiveSessionException;
import com.atlas.journal.exception.PermissionDeniedException;
import com.atlas.journal.exception.RetryExhaustedException;
import com.atlas.journal.exception.SessionAlreadyActiveException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the journal engine.
 * Maps the engine's exceptions to HTTP statuses with a consistent error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    /**
     * Handles validation errors from @Valid annotations.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> errorResponse = buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed");
        errorResponse.put("fieldErrors", fieldErrors);

        log.warn("Validation error: {}", fieldErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({ConstraintViolationException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleRequestParameterErrors(Exception ex) {
        log.warn("Invalid request parameter: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(buildErrorResponse(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    /**
     * Handles unreadable bodies, including coordinates rejected while the body was deserialized.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String message = cause instanceof InvalidCoordinateException
                ? cause.getMessage()
                : "Malformed request body";
        log.warn("Unreadable request body: {}", cause.getMessage());
        return ResponseEntity.badRequest()
                .body(buildErrorResponse(HttpStatus.BAD_REQUEST, "Bad Request", message));
    }

    @ExceptionHandler(InvalidCoordinateException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCoordinate(InvalidCoordinateException ex) {
        log.warn("Invalid coordinate: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Coordinate", ex.getMessage()));
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> handlePermissionDenied(PermissionDeniedException ex) {
        log.warn("Permission denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(buildErrorResponse(HttpStatus.FORBIDDEN, "Permission Denied", ex.getMessage()));
    }

    @ExceptionHandler(NoActiveSessionException.class)
    public ResponseEntity<Map<String, Object>> handleNoActiveSession(NoActiveSessionException ex) {
        log.warn("No active session: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(buildErrorResponse(HttpStatus.CONFLICT, "No Active Session", ex.getMessage()));
    }

    @ExceptionHandler(CurationInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleCurationInProgress(CurationInProgressException ex) {
        log.warn("Curation conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(buildErrorResponse(HttpStatus.CONFLICT, "Curation In Progress", ex.getMessage()));
    }

    @ExceptionHandler(SessionAlreadyActiveException.class)
    public ResponseEntity<Map<String, Object>> handleSessionAlreadyActive(SessionAlreadyActiveException ex) {
        log.warn("Duplicate start: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(buildErrorResponse(HttpStatus.CONFLICT, "Session Already Active", ex.getMessage()));
    }

    @ExceptionHandler(DeviceReportingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleDeviceReportingUnavailable(
            DeviceReportingUnavailableException ex) {
        log.warn("Device report refused: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
                .body(buildErrorResponse(HttpStatus.NOT_IMPLEMENTED, "Not Implemented", ex.getMessage()));
    }

    /**
     * Handles sink deliveries that failed after every retry.
     */
    @ExceptionHandler(RetryExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleRetryExhausted(RetryExhaustedException ex) {
        log.error("Journal sink unavailable after {} attempts", ex.getAttempts(), ex.getLastError());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage()));
    }

    /**
     * Handles all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                        "An unexpected error occurred"));
    }

    private Map<String, Object> buildErrorResponse(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put(TIMESTAMP, Instant.now());
        errorResponse.put(STATUS, status.value());
        errorResponse.put(ERROR, error);
        errorResponse.put(MESSAGE, message);
        return errorResponse;
    }
}
