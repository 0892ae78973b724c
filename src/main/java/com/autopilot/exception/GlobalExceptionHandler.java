package com.autopilot.exception;

import com.autopilot.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps control-surface failures to the {@link ApiErrorResponse} envelope.
 *
 * <p>Adapter failures are upstream problems (502, or 504 on a deadline) and are logged without a stack
 * trace unless the adapter rejected the call outright. State conflicts are expected operator races and
 * only logged at INFO.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new TreeMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), error.getDefaultMessage()));
        log.debug("Rejected {} {}: invalid fields {}", request.getMethod(), request.getRequestURI(), details.keySet());
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Validation failed", details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> details = new TreeMap<>();
        ex.getConstraintViolations()
                .forEach(violation -> details.put(violation.getPropertyPath().toString(), violation.getMessage()));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.NOT_FOUND, "No endpoint " + request.getRequestURI(), null, request);
    }

    @ExceptionHandler(AdapterException.class)
    public ResponseEntity<ApiErrorResponse> handleAdapter(AdapterException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.isTimeout() ? ErrorCode.ADAPTER_TIMEOUT : ex.getErrorCode();
        if (ex.isTransientFailure()) {
            log.warn("{} {} failed upstream ({}): {}", request.getMethod(), request.getRequestURI(), ex.getAdapter(),
                    ex.getMessage());
        } else {
            log.error("{} {} rejected by {}: {}", request.getMethod(), request.getRequestURI(), ex.getAdapter(),
                    ex.getMessage(), ex);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("adapter", ex.getAdapter().name());
        details.put("timeout", ex.isTimeout());
        return buildResponse(errorCode, ex.getMessage(), details, request, ex.isTransientFailure());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(ConflictException ex, HttpServletRequest request) {
        log.info("Conflict on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return buildResponse(ErrorCode.CONFLICT, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.isServerError()) {
            log.error("Server error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("Client error on {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return buildResponse(errorCode, message, details, request, null);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode,
            String message,
            Map<String, Object> details,
            HttpServletRequest request,
            Boolean retryable) {
        ApiErrorResponse response =
                ApiErrorResponse.of(errorCode, message, details, request.getRequestURI(), retryable);
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
