package com.locofleet.fleethealth.api;

import com.locofleet.common.exception.FleetException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps fleet failures to consistent JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InstanceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleInstanceNotFound(
            InstanceNotFoundException ex, HttpServletRequest request) {
        log.warn("Instance not found: {}", ex.getInstanceId());
        return build(HttpStatus.NOT_FOUND, "INSTANCE_NOT_FOUND", ex.getMessage(), request,
            Map.of("instanceId", ex.getInstanceId()));
    }

    @ExceptionHandler(FleetException.class)
    public ResponseEntity<ErrorResponse> handleFleetException(
            FleetException ex, HttpServletRequest request) {
        log.error("Fleet operation failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, "FLEET_OPERATION_FAILED", ex.getMessage(), request, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred",
            request, null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message,
                                                HttpServletRequest request, Map<String, Object> metadata) {
        ErrorResponse error = ErrorResponse.builder()
            .errorCode(errorCode)
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .metadata(metadata)
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
