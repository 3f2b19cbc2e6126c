package com.platform.servicehost.error;

import com.platform.servicehost.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * RULES:
 * - Never swallow exceptions (always log)
 * - Never return HTTP 200 on failure
 * - Always include error code for client action
 * - Distinguish fatal vs recoverable
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Service Host Exceptions ====================
    
    @ExceptionHandler(ServiceOperationException.class)
    public ResponseEntity<ErrorResponse> handleServiceOperation(
            ServiceOperationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (status.is5xxServerError()) {
            log.error("[{}] {} {} failed on {}: {}", traceId, errorCode.getCode(),
                ex.getOperation(), ex.getServiceId(), ex.getMessage());
        } else {
            log.warn("[{}] {} {} rejected on {}: {}", traceId, errorCode.getCode(),
                ex.getOperation(), ex.getServiceId(), ex.getMessage());
        }
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), status.value(),
            request.getRequestURI(), traceId);
        response.setDetail(ex.getDetail());
        response.setServiceId(ex.getServiceId());
        response.setOperation(ex.getOperation() != null ? ex.getOperation().name() : null);
        response.setElapsedMs(ex.getElapsedMs());
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId);
        response.setServiceId(ex.getResourceId());
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(OperationConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(
            OperationConflictException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Conflict on {}: {}", traceId, ex.getServiceId(), ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.CONFLICT.value(), request.getRequestURI(), traceId);
        response.setServiceId(ex.getServiceId());
        if (ex.getCurrentStatus() != null) {
            response.setMetadata(Map.of("currentStatus", ex.getCurrentStatus().name()));
        }
        
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        if (ex.getField() != null) {
            response.setFieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(ServiceHostException.class)
    public ResponseEntity<ErrorResponse> handleServiceHostException(
            ServiceHostException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);
        
        return ResponseEntity.status(status).body(
            ErrorResponse.of(errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId));
    }
    
    // ==================== Spring Validation ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Validation failed",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ErrorResponse.FieldError.builder()
                .field(getFieldName(cv))
                .message(cv.getMessage())
                .rejectedValue(cv.getInvalidValue())
                .build())
            .toList();
        
        log.warn("[{}] Constraint violation: {} violations", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Constraint violation",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(
            ErrorResponse.of(ErrorCode.INVALID_REQUEST,
                String.format("Method %s not supported for this endpoint", ex.getMethod()),
                HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), traceId));
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("servicehost.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case SERVICE_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case OPERATION_CONFLICT, OPERATION_IN_PROGRESS ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_PATH,
                 UNSAFE_ARGUMENTS, INVALID_EXECUTABLE, INVALID_DEPENDENCY ->
                HttpStatus.BAD_REQUEST;
            case HOST_TOOL_FAILED, SERVICE_CONTROL_FAILED ->
                HttpStatus.BAD_GATEWAY;
            case OPERATION_TIMEOUT ->
                HttpStatus.GATEWAY_TIMEOUT;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
    
    private String getFieldName(ConstraintViolation<?> cv) {
        String path = cv.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot > 0 ? path.substring(lastDot + 1) : path;
    }
}
