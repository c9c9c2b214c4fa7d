package com.positionkeeper.exception;

import com.positionkeeper.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps engine failures onto the error envelope. Request problems log at WARN, exchange
 * trouble at WARN with the retry hint, anything that leaves a position unprotected at ERROR.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** Seconds an operator should wait before retrying a call on a busy position. */
    static final String BUSY_RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return respond(ErrorCode.VALIDATION_ERROR, "Validation failed", details, null, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getConstraintViolations()
                .forEach(violation -> details.put(violation.getPropertyPath().toString(), violation.getMessage()));
        return respond(ErrorCode.VALIDATION_ERROR, "Validation failed", details, null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Malformed request body", null, null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, ex.getMessage(), null, null, request);
    }

    @ExceptionHandler(UnprotectedPositionException.class)
    public ResponseEntity<ApiErrorResponse> handleUnprotected(
            UnprotectedPositionException ex, HttpServletRequest request) {
        log.error(
                "CRITICAL: position {} left without a stop: {} details={}",
                ex.positionId().orElse("unknown"),
                ex.getMessage(),
                ex.getDetails(),
                ex);
        return respond(ex, request);
    }

    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ApiErrorResponse> handleExchange(ExchangeException ex, HttpServletRequest request) {
        log.warn("Exchange failure on {} ({}, retryable): {}", request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        return respond(ex, request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        if (ex.getErrorCode().getHttpStatus() >= 500) {
            log.error("Server error: {}", ex.getMessage(), ex);
        } else {
            log.warn("Rejected {}: {} {}", request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        }
        ResponseEntity<ApiErrorResponse> response = respond(ex, request);
        if (ex.getErrorCode() == ErrorCode.CONFLICT && ex.positionId().isPresent()) {
            return ResponseEntity.status(response.getStatusCode())
                    .header(HttpHeaders.RETRY_AFTER, BUSY_RETRY_AFTER_SECONDS)
                    .body(response.getBody());
        }
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, null, request);
    }

    private ResponseEntity<ApiErrorResponse> respond(BaseException ex, HttpServletRequest request) {
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), ex.positionId().orElse(null), request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode,
            String message,
            Map<String, Object> details,
            String positionId,
            HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.of(errorCode, message, details, positionId, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
